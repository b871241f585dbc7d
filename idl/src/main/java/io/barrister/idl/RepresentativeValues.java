package io.barrister.idl;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.barrister.spec.EnumValue;
import io.barrister.spec.Field;
import org.jspecify.annotations.Nullable;

/**
 * Synthesizes a deterministic sample value for an IDL field.
 * <p>
 * Handler registration runs these values through the value converter against each
 * handler method's declared parameter and result types, so that any drift between the IDL
 * and the implementation is detected before a request is served.
 * <table>
 *   <caption>Sample values</caption>
 *   <tr><th>IDL type</th><th>value</th></tr>
 *   <tr><td>string</td><td>{@value #STRING_VALUE}</td></tr>
 *   <tr><td>int</td><td>{@value #INT_VALUE}</td></tr>
 *   <tr><td>float</td><td>{@value #FLOAT_VALUE}</td></tr>
 *   <tr><td>bool</td><td>{@code true}</td></tr>
 *   <tr><td>array</td><td>a one-element list</td></tr>
 *   <tr><td>struct</td><td>a map with a sample for every resolved field</td></tr>
 *   <tr><td>enum</td><td>the first declared value</td></tr>
 * </table>
 * A struct that refers back to itself yields {@code null} for an optional reference and an
 * empty list for an array reference.
 */
public final class RepresentativeValues {

    public static final String STRING_VALUE = "testval";
    public static final long INT_VALUE = 99L;
    public static final double FLOAT_VALUE = 10.3;

    private RepresentativeValues() {
    }

    /**
     * Returns the sample value of a field.
     *
     * @param idl the contract model used to resolve struct and enum names
     * @param field the field
     * @return the sample value
     * @throws SchemaException if the field references an unknown type, an enum without values,
     *         or a struct that can only be satisfied by an infinite value
     */
    public static @Nullable Object of(Idl idl, Field field) {
        return sample(idl, field, new ArrayDeque<>());
    }

    private static @Nullable Object sample(Idl idl, Field field, Deque<String> structPath) {
        if (field.isArray()) {
            if (structPath.contains(field.type())) {
                return List.of();
            }
            return Collections.singletonList(sample(idl, field.elementField(), structPath));
        }

        switch (field.type()) {
            case Field.STRING:
                return STRING_VALUE;
            case Field.INT:
                return INT_VALUE;
            case Field.FLOAT:
                return FLOAT_VALUE;
            case Field.BOOL:
                return Boolean.TRUE;
            default:
                break;
        }

        Struct struct = idl.lookupStruct(field.type());
        if (struct != null) {
            if (structPath.contains(struct.name())) {
                if (field.optional()) {
                    return null;
                }
                throw new SchemaException("Struct " + struct.name() + " requires itself through field '"
                        + field.name() + "'");
            }
            structPath.push(struct.name());
            Map<String, Object> value = new LinkedHashMap<>();
            for (Field structField : struct.resolvedFields().values()) {
                value.put(structField.name(), sample(idl, structField, structPath));
            }
            structPath.pop();
            return value;
        }

        List<EnumValue> values = idl.lookupEnum(field.type());
        if (values != null) {
            if (values.isEmpty()) {
                throw new SchemaException("Enum " + field.type() + " declares no values");
            }
            return values.get(0).value();
        }

        throw new SchemaException("Unable to create value for field: " + field.name() + " type: " + field.type());
    }
}
