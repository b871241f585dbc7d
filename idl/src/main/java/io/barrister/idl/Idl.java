package io.barrister.idl;

import static io.barrister.util.Utils.OBJECT_MAPPER;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import io.barrister.spec.EnumElement;
import io.barrister.spec.EnumValue;
import io.barrister.spec.Field;
import io.barrister.spec.Function;
import io.barrister.spec.IdlElement;
import io.barrister.spec.InterfaceElement;
import io.barrister.spec.MetaElement;
import io.barrister.spec.StructElement;
import io.barrister.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The contract model of a Barrister IDL document.
 * <p>
 * An Idl indexes the raw {@link IdlElement} sequence into four lookup tables:
 * <ul>
 *   <li>interfaces - interface name to its ordered functions</li>
 *   <li>methods - {@code "Interface.function"} to the {@link Function}, used for dispatch</li>
 *   <li>structs - struct name to its {@link Struct}, including the resolved field set</li>
 *   <li>enums - enum name to its ordered values</li>
 * </ul>
 * The tables are computed once, when the model is built, and never change afterwards.
 * Building the same elements twice yields equal models.
 *
 * <h2>Struct inheritance</h2>
 * Each struct's resolved field set is computed by walking its {@code extends} chain towards
 * the root. A chain that names an unknown struct simply stops there, as does a chain that
 * loops back onto a struct already visited.
 *
 * <pre>{@code
 * Idl idl = Idl.parse(Files.readAllBytes(Path.of("service.json")));
 * Function echo = idl.lookupMethod("B.echo");
 * }</pre>
 */
public final class Idl {

    private static final Logger LOGGER = LoggerFactory.getLogger(Idl.class);

    /**
     * The reserved JSON-RPC method that returns the raw IDL elements of a service.
     */
    public static final String IDL_METHOD = "barrister-idl";

    private static final TypeReference<List<IdlElement>> ELEMENTS_TYPE_REFERENCE = new TypeReference<>() {};
    private static final JavaType ELEMENTS_TYPE = OBJECT_MAPPER.getTypeFactory().constructType(ELEMENTS_TYPE_REFERENCE);

    private final List<IdlElement> elements;
    private final JsonNode document;
    private final Meta meta;
    private final Map<String, List<Function>> interfaces;
    private final Map<String, Function> methods;
    private final Map<String, Struct> structs;
    private final Map<String, List<EnumValue>> enums;

    private Idl(List<IdlElement> elements, JsonNode document) {
        this.elements = List.copyOf(elements);
        this.document = document;

        Meta meta = Meta.EMPTY;
        Map<String, List<Function>> interfaces = new LinkedHashMap<>();
        Map<String, Function> methods = new LinkedHashMap<>();
        Map<String, StructElement> structElements = new LinkedHashMap<>();
        Map<String, List<EnumValue>> enums = new LinkedHashMap<>();

        for (IdlElement element : this.elements) {
            if (element instanceof MetaElement metaElement) {
                meta = Meta.of(metaElement);
            } else if (element instanceof InterfaceElement iface) {
                for (Function function : iface.functions()) {
                    methods.put(iface.name() + "." + function.name(), function);
                }
                interfaces.put(iface.name(), iface.functions());
            } else if (element instanceof StructElement struct) {
                structElements.put(struct.name(), struct);
            } else if (element instanceof EnumElement enumElement) {
                enums.put(enumElement.name(), enumElement.values());
            }
        }

        Map<String, Struct> structs = new LinkedHashMap<>();
        for (StructElement struct : structElements.values()) {
            structs.put(struct.name(), new Struct(struct.name(), struct.extendsName(), struct.fields(),
                    resolveFields(struct, structElements)));
        }

        this.meta = meta;
        this.interfaces = Collections.unmodifiableMap(interfaces);
        this.methods = Collections.unmodifiableMap(methods);
        this.structs = Collections.unmodifiableMap(structs);
        this.enums = Collections.unmodifiableMap(enums);

        LOGGER.debug("Built contract model: {} interfaces, {} methods, {} structs, {} enums",
                interfaces.size(), methods.size(), structs.size(), enums.size());
    }

    /**
     * Decodes an IDL document and builds its contract model.
     *
     * @param json the IDL document, a JSON array of elements
     * @return the contract model
     * @throws IdlParseException if the document cannot be decoded
     */
    public static Idl parse(byte[] json) throws IdlParseException {
        Assert.checkNotNullParam("json", json);
        JsonNode document;
        try {
            document = OBJECT_MAPPER.readTree(json);
        } catch (IOException e) {
            throw new IdlParseException("Unable to parse IDL JSON: " + e.getMessage(), e);
        }
        return decode(document);
    }

    /**
     * Decodes an IDL document and builds its contract model.
     *
     * @param json the IDL document, a JSON array of elements
     * @return the contract model
     * @throws IdlParseException if the document cannot be decoded
     */
    public static Idl parse(String json) throws IdlParseException {
        Assert.checkNotNullParam("json", json);
        JsonNode document;
        try {
            document = OBJECT_MAPPER.readTree(json);
        } catch (IOException e) {
            throw new IdlParseException("Unable to parse IDL JSON: " + e.getMessage(), e);
        }
        return decode(document);
    }

    /**
     * Reads and decodes an IDL document. The stream is not closed.
     *
     * @param in the stream holding the IDL document
     * @return the contract model
     * @throws IdlParseException if the document cannot be read or decoded
     */
    public static Idl parse(InputStream in) throws IdlParseException {
        Assert.checkNotNullParam("in", in);
        try {
            return parse(in.readAllBytes());
        } catch (IOException e) {
            throw new IdlParseException("Unable to read IDL: " + e.getMessage(), e);
        }
    }

    /**
     * Builds the contract model from decoded elements.
     *
     * @param elements the IDL elements, in document order
     * @return the contract model
     */
    public static Idl build(List<IdlElement> elements) {
        Assert.checkNotNullParam("elements", elements);
        return new Idl(elements, encode(elements));
    }

    private static Idl decode(@Nullable JsonNode document) throws IdlParseException {
        if (document == null || !document.isArray()) {
            throw new IdlParseException("IDL document must be a JSON array of elements");
        }
        List<IdlElement> elements;
        try {
            elements = OBJECT_MAPPER.treeToValue(document, ELEMENTS_TYPE);
        } catch (IOException | IllegalArgumentException e) {
            throw new IdlParseException("Unable to parse IDL JSON: " + e.getMessage(), e);
        }
        return new Idl(elements, document);
    }

    // the element type must be explicit for the writer to emit the 'type' discriminator
    private static JsonNode encode(List<IdlElement> elements) {
        try {
            return OBJECT_MAPPER.readTree(OBJECT_MAPPER.writerFor(ELEMENTS_TYPE_REFERENCE).writeValueAsBytes(elements));
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to encode IDL elements: " + e.getMessage(), e);
        }
    }

    private static Map<String, Field> resolveFields(StructElement struct, Map<String, StructElement> structElements) {
        Deque<StructElement> chain = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        StructElement current = struct;
        while (current != null && visited.add(current.name())) {
            chain.push(current);
            String parent = current.extendsName();
            current = parent == null ? null : structElements.get(parent);
        }

        // root first, so that fields declared closer to the struct replace inherited ones
        Map<String, Field> resolved = new LinkedHashMap<>();
        for (StructElement element : chain) {
            for (Field field : element.fields()) {
                resolved.put(field.name(), field);
            }
        }
        return resolved;
    }

    /**
     * Looks up a function by its qualified name.
     *
     * @param qualifiedName the method name, {@code "Interface.function"}
     * @return the function, or {@code null} if the IDL declares no such method
     */
    public @Nullable Function lookupMethod(String qualifiedName) {
        return methods.get(qualifiedName);
    }

    /**
     * Looks up the functions of an interface.
     *
     * @param name the interface name
     * @return the functions in declaration order, or {@code null} if there is no such interface
     */
    public @Nullable List<Function> lookupInterface(String name) {
        return interfaces.get(name);
    }

    /**
     * Looks up a struct.
     *
     * @param name the struct name
     * @return the struct, or {@code null} if there is no such struct
     */
    public @Nullable Struct lookupStruct(String name) {
        return structs.get(name);
    }

    /**
     * Looks up the values of an enum.
     *
     * @param name the enum name
     * @return the values in declaration order, or {@code null} if there is no such enum
     */
    public @Nullable List<EnumValue> lookupEnum(String name) {
        return enums.get(name);
    }

    /**
     * Returns the decoded elements, in document order.
     *
     * @return the unmodifiable element list
     */
    public List<IdlElement> rawElements() {
        return elements;
    }

    /**
     * Returns the IDL document as JSON. This is the result of the {@value #IDL_METHOD}
     * introspection method.
     * <p>
     * A parsed model returns the document exactly as it was read, attributes the elements
     * do not model included. A model built from elements returns their encoded form.
     *
     * @return a copy of the document, a JSON array
     */
    public JsonNode document() {
        return document.deepCopy();
    }

    public Map<String, List<Function>> interfaces() {
        return interfaces;
    }

    public Map<String, Function> methods() {
        return methods;
    }

    public Map<String, Struct> structs() {
        return structs;
    }

    public Map<String, List<EnumValue>> enums() {
        return enums;
    }

    /**
     * Returns the compiler metadata of the document.
     *
     * @return the metadata, {@link Meta#EMPTY} when the document has no {@code meta} element
     */
    public Meta meta() {
        return meta;
    }

    /**
     * Returns the qualified names of all methods of an interface.
     *
     * @param interfaceName the interface name
     * @return the method names, empty if there is no such interface
     */
    public List<String> methodNames(String interfaceName) {
        List<Function> functions = interfaces.get(interfaceName);
        if (functions == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>(functions.size());
        for (Function function : functions) {
            names.add(interfaceName + "." + function.name());
        }
        return names;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Idl other)) {
            return false;
        }
        return elements.equals(other.elements)
                && structs.equals(other.structs)
                && methods.equals(other.methods)
                && enums.equals(other.enums);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "Idl{interfaces=" + interfaces.keySet() + ", structs=" + structs.keySet()
                + ", enums=" + enums.keySet() + ", meta=" + meta + "}";
    }

    /**
     * Compiler metadata of an IDL document.
     * <p>
     * The {@code meta} element records the generation date in milliseconds; the model
     * scales it by {@value #NANOS_PER_MILLI} so that {@code dateGenerated} is always in
     * nanoseconds since the epoch.
     *
     * @param barristerVersion the IDL compiler version
     * @param dateGenerated the generation date in nanoseconds since the epoch
     * @param checksum the IDL checksum
     */
    public record Meta(String barristerVersion, long dateGenerated, String checksum) {

        public static final long NANOS_PER_MILLI = 1_000_000L;

        public static final Meta EMPTY = new Meta("", 0L, "");

        static Meta of(MetaElement element) {
            return new Meta(element.barristerVersion(), element.dateGenerated() * NANOS_PER_MILLI, element.checksum());
        }

        /**
         * Returns the generation date as an instant.
         *
         * @return the instant the IDL was generated
         */
        public Instant generatedAt() {
            return Instant.ofEpochSecond(0L, dateGenerated);
        }
    }
}
