package io.barrister.idl.convert;

import java.lang.reflect.Array;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.fasterxml.jackson.databind.util.ClassUtil;
import io.barrister.idl.Idl;
import io.barrister.idl.SchemaException;
import io.barrister.idl.Struct;
import io.barrister.spec.EnumValue;
import io.barrister.spec.Field;
import io.barrister.util.Assert;
import io.barrister.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Validates untyped values against IDL field types and converts them to Java types.
 * <p>
 * The input is the dynamic tree produced by a JSON decoder: {@link Map}, {@link List},
 * {@link String}, {@link Number}, {@link Boolean} or {@code null}. The output has the shape
 * of the requested target type:
 * <ul>
 *   <li>{@code string} - {@link String} or any supertype such as {@link CharSequence}</li>
 *   <li>{@code int} - {@code long}, {@code int}, {@code short}, {@code byte}, their boxes or
 *       {@link BigInteger}; a number with a fractional part is rejected, never truncated</li>
 *   <li>{@code float} - {@code double}, {@code float}, their boxes or {@link BigDecimal}</li>
 *   <li>{@code bool} - {@code boolean} or {@link Boolean}</li>
 *   <li>arrays - a {@link List} type or a Java array type</li>
 *   <li>structs - a {@code Map<String, ?>} or a bean or record class with a property for every
 *       resolved field of the struct</li>
 *   <li>enums - {@link String} or a Java enum whose JSON names include the IDL value</li>
 * </ul>
 * Targeting {@link Object} keeps the value dynamic: it is validated and normalized, ints to
 * {@link Long}, floats to {@link Double}, structs to {@link LinkedHashMap} and arrays to
 * {@link ArrayList}.
 *
 * <h2>Failures</h2>
 * A value that does not conform, or that the target type cannot hold, raises a
 * {@link ConversionException} naming the path of the value. A field whose type names neither a
 * primitive nor a declared struct or enum raises a {@link SchemaException}: the IDL is defective
 * and no request can be served against it.
 *
 * <p>The converter only reads the immutable contract model. It never modifies its input and
 * may be shared between threads.
 */
public class Converter {

    private final Idl idl;
    private final ObjectMapper objectMapper;
    private final TypeFactory typeFactory;
    private final JavaType objectType;

    /**
     * Creates a converter using {@link Utils#OBJECT_MAPPER} to build bean, record and enum values.
     *
     * @param idl the contract model
     */
    public Converter(Idl idl) {
        this(idl, Utils.OBJECT_MAPPER);
    }

    /**
     * Creates a converter.
     *
     * @param idl the contract model
     * @param objectMapper the mapper used to introspect and build bean, record and enum values
     */
    public Converter(Idl idl, ObjectMapper objectMapper) {
        this.idl = Assert.checkNotNullParam("idl", idl);
        this.objectMapper = Assert.checkNotNullParam("objectMapper", objectMapper);
        this.typeFactory = objectMapper.getTypeFactory();
        this.objectType = typeFactory.constructType(Object.class);
    }

    /**
     * Converts a value to the dynamic representation, validating it against {@code field}.
     *
     * @param field the IDL field descriptor
     * @param value the value
     * @param path the path of the value, used in error messages
     * @return the normalized value
     * @throws ConversionException if the value does not conform to the field
     */
    public @Nullable Object convert(Field field, @Nullable Object value, String path) throws ConversionException {
        return convert(field, objectType, value, path);
    }

    /**
     * Converts a value to {@code target}, validating it against {@code field}.
     *
     * @param field the IDL field descriptor
     * @param target the Java type to produce, for example a method parameter's generic type
     * @param value the value
     * @param path the path of the value, used in error messages
     * @return the converted value
     * @throws ConversionException if the value does not conform to the field or the target
     *         type cannot represent it
     */
    public @Nullable Object convert(Field field, Type target, @Nullable Object value, String path) throws ConversionException {
        return convert(field, typeFactory.constructType(target), value, path);
    }

    /**
     * Converts a value to {@code target}, validating it against {@code field}.
     *
     * @param field the IDL field descriptor
     * @param target the Java type to produce
     * @param value the value
     * @param path the path of the value, used in error messages
     * @return the converted value
     * @throws ConversionException if the value does not conform to the field or the target
     *         type cannot represent it
     */
    public @Nullable Object convert(Field field, JavaType target, @Nullable Object value, String path) throws ConversionException {
        Assert.checkNotNullParam("field", field);
        Assert.checkNotNullParam("target", target);
        Assert.checkNotNullParam("path", path);

        if (value == null) {
            if (field.optional()) {
                return absent(target);
            }
            throw new ConversionException(path, "null value for required field of type " + describe(field));
        }

        if (field.isArray()) {
            return convertArray(field, target, value, path);
        }

        switch (field.type()) {
            case Field.STRING:
                return convertString(field, target, value, path);
            case Field.INT:
                return convertInt(field, target, value, path);
            case Field.FLOAT:
                return convertFloat(field, target, value, path);
            case Field.BOOL:
                return convertBool(field, target, value, path);
            default:
                break;
        }

        Struct struct = idl.lookupStruct(field.type());
        if (struct != null) {
            return convertStruct(struct, field, target, value, path);
        }

        List<EnumValue> enumValues = idl.lookupEnum(field.type());
        if (enumValues != null) {
            return convertEnum(field, enumValues, target, value, path);
        }

        throw new SchemaException("Unknown type '" + field.type() + "' for field '" + field.name()
                + "' at " + (path.isEmpty() ? "<root>" : path));
    }

    private @Nullable Object absent(JavaType target) {
        if (target.isPrimitive()) {
            return ClassUtil.defaultValue(target.getRawClass());
        }
        return null;
    }

    private Object convertArray(Field field, JavaType target, Object value, String path) throws ConversionException {
        List<?> source = asList(value);
        if (source == null) {
            throw mismatch(field, value, path);
        }

        JavaType elementType;
        boolean javaArray = false;
        if (isDynamic(target)) {
            elementType = objectType;
        } else if (target.isArrayType()) {
            elementType = target.getContentType();
            javaArray = true;
        } else if (target.isCollectionLikeType() && target.getRawClass().isAssignableFrom(ArrayList.class)) {
            elementType = target.getContentType();
        } else {
            throw unrepresentable(field, target, path);
        }

        Field elementField = field.elementField();
        List<Object> converted = new ArrayList<>(source.size());
        for (int i = 0; i < source.size(); i++) {
            converted.add(convert(elementField, elementType, source.get(i), path + "[" + i + "]"));
        }

        if (javaArray) {
            Object array = Array.newInstance(elementType.getRawClass(), converted.size());
            for (int i = 0; i < converted.size(); i++) {
                Array.set(array, i, converted.get(i));
            }
            return array;
        }
        return converted;
    }

    private static @Nullable List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        return null;
    }

    private Object convertString(Field field, JavaType target, Object value, String path) throws ConversionException {
        if (!(value instanceof String)) {
            throw mismatch(field, value, path);
        }
        if (!target.getRawClass().isAssignableFrom(String.class)) {
            throw unrepresentable(field, target, path);
        }
        return value;
    }

    private Object convertInt(Field field, JavaType target, Object value, String path) throws ConversionException {
        if (!(value instanceof Number number)) {
            throw mismatch(field, value, path);
        }
        BigInteger integral = toBigInteger(number);
        if (integral == null) {
            throw new ConversionException(path, "expected int but got non-integral number " + value);
        }

        Class<?> raw = target.getRawClass();
        try {
            if (raw == long.class || raw == Long.class || raw == Number.class || isDynamic(target)) {
                return integral.longValueExact();
            } else if (raw == int.class || raw == Integer.class) {
                return integral.intValueExact();
            } else if (raw == short.class || raw == Short.class) {
                return integral.shortValueExact();
            } else if (raw == byte.class || raw == Byte.class) {
                return integral.byteValueExact();
            } else if (raw == BigInteger.class) {
                return integral;
            }
        } catch (ArithmeticException e) {
            throw new ConversionException(path, "int value " + integral + " out of range for "
                    + target.toCanonical(), e);
        }
        throw unrepresentable(field, target, path);
    }

    private static @Nullable BigInteger toBigInteger(Number number) {
        if (number instanceof BigInteger bigInteger) {
            return bigInteger;
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return BigInteger.valueOf(number.longValue());
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
                return null;
            }
            return BigDecimal.valueOf(d).toBigIntegerExact();
        }
        BigDecimal decimal;
        if (number instanceof BigDecimal bigDecimal) {
            decimal = bigDecimal;
        } else {
            try {
                decimal = new BigDecimal(number.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            return decimal.toBigIntegerExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private Object convertFloat(Field field, JavaType target, Object value, String path) throws ConversionException {
        if (!(value instanceof Number number)) {
            throw mismatch(field, value, path);
        }
        Class<?> raw = target.getRawClass();
        if (raw == double.class || raw == Double.class || raw == Number.class || isDynamic(target)) {
            return number.doubleValue();
        } else if (raw == float.class || raw == Float.class) {
            return number.floatValue();
        } else if (raw == BigDecimal.class) {
            return number instanceof BigDecimal ? number : new BigDecimal(number.toString());
        }
        throw unrepresentable(field, target, path);
    }

    private Object convertBool(Field field, JavaType target, Object value, String path) throws ConversionException {
        if (!(value instanceof Boolean)) {
            throw mismatch(field, value, path);
        }
        Class<?> raw = target.getRawClass();
        if (raw == boolean.class || raw.isAssignableFrom(Boolean.class)) {
            return value;
        }
        throw unrepresentable(field, target, path);
    }

    private Object convertStruct(Struct struct, Field field, JavaType target, Object value, String path)
            throws ConversionException {
        if (!(value instanceof Map<?, ?> source)) {
            throw mismatch(field, value, path);
        }

        if (isDynamic(target) || target.isMapLikeType()) {
            JavaType valueType = objectType;
            if (target.isMapLikeType()) {
                if (!target.getKeyType().getRawClass().isAssignableFrom(String.class)) {
                    throw unrepresentable(field, target, path);
                }
                valueType = target.getContentType();
            }
            Map<String, Object> converted = new LinkedHashMap<>();
            for (Field structField : struct.resolvedFields().values()) {
                converted.put(structField.name(), convert(structField, valueType,
                        source.get(structField.name()), child(path, structField.name())));
            }
            return converted;
        }

        if (!isBean(target)) {
            throw unrepresentable(field, target, path);
        }

        BeanDescription description = objectMapper.getDeserializationConfig().introspect(target);
        Map<String, BeanPropertyDefinition> properties = new HashMap<>();
        // record components are only visible through their accessors
        for (BeanPropertyDefinition property : description.findProperties()) {
            if (property.couldDeserialize() || property.hasGetter()) {
                properties.put(property.getName(), property);
            }
        }

        Map<String, Object> converted = new LinkedHashMap<>();
        for (Field structField : struct.resolvedFields().values()) {
            BeanPropertyDefinition property = properties.get(structField.name());
            if (property == null) {
                throw new ConversionException(path, target.getRawClass().getName() + " has no property '"
                        + structField.name() + "' for struct " + struct.name());
            }
            converted.put(structField.name(), convert(structField, property.getPrimaryType(),
                    source.get(structField.name()), child(path, structField.name())));
        }

        try {
            return objectMapper.convertValue(converted, target);
        } catch (IllegalArgumentException e) {
            throw new ConversionException(path, "unable to create " + target.getRawClass().getName()
                    + " for struct " + struct.name() + ": " + e.getMessage(), e);
        }
    }

    private Object convertEnum(Field field, List<EnumValue> enumValues, JavaType target, Object value, String path)
            throws ConversionException {
        if (!(value instanceof String text)) {
            throw mismatch(field, value, path);
        }
        List<String> allowed = new ArrayList<>(enumValues.size());
        for (EnumValue enumValue : enumValues) {
            allowed.add(enumValue.value());
        }
        if (!allowed.contains(text)) {
            throw new ConversionException(path, "value '" + text + "' is not in enum " + field.type()
                    + ", allowed values: " + allowed);
        }

        if (target.getRawClass().isAssignableFrom(String.class)) {
            return text;
        }
        if (target.isEnumType()) {
            try {
                return objectMapper.convertValue(text, target);
            } catch (IllegalArgumentException e) {
                throw new ConversionException(path, target.getRawClass().getName() + " has no constant for value '"
                        + text + "' of enum " + field.type(), e);
            }
        }
        throw unrepresentable(field, target, path);
    }

    private static boolean isDynamic(JavaType target) {
        return target.getRawClass() == Object.class;
    }

    private static boolean isBean(JavaType target) {
        Class<?> raw = target.getRawClass();
        return !target.isPrimitive()
                && !target.isArrayType()
                && !target.isEnumType()
                && !target.isContainerType()
                && !raw.isInterface()
                && !raw.getName().startsWith("java.");
    }

    private static String child(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    private static String describe(Field field) {
        return field.isArray() ? "[]" + field.type() : field.type();
    }

    private static ConversionException mismatch(Field field, Object value, String path) {
        return new ConversionException(path, "expected " + describe(field) + " but got " + describeValue(value));
    }

    private static ConversionException unrepresentable(Field field, JavaType target, String path) {
        return new ConversionException(path, "IDL type " + describe(field) + " cannot be represented as "
                + target.toCanonical());
    }

    private static String describeValue(Object value) {
        if (value instanceof String) {
            return "string";
        } else if (value instanceof Boolean) {
            return "bool";
        } else if (value instanceof Number) {
            return "number " + value;
        } else if (value instanceof Map) {
            return "object";
        } else if (value instanceof Collection || value.getClass().isArray()) {
            return "array";
        }
        return value.getClass().getName();
    }
}
