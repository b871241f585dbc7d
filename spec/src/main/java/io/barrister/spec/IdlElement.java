package io.barrister.spec;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One element of a Barrister IDL document.
 * <p>
 * An IDL document is an ordered JSON array of elements, each selected by its {@code type}
 * discriminator:
 * <ul>
 *   <li>{@link CommentElement} - a free-standing comment block</li>
 *   <li>{@link EnumElement} - a named, ordered set of string values</li>
 *   <li>{@link StructElement} - a named record type, optionally extending another struct</li>
 *   <li>{@link InterfaceElement} - a named, ordered list of {@link Function}s</li>
 *   <li>{@link MetaElement} - compiler version, generation date and checksum</li>
 * </ul>
 * Each variant carries only the attributes relevant to it. The raw element sequence is
 * what the {@code barrister-idl} introspection method returns.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type"
)
@JsonSubTypes({
        @JsonSubTypes.Type(value = CommentElement.class, name = CommentElement.COMMENT),
        @JsonSubTypes.Type(value = EnumElement.class, name = EnumElement.ENUM),
        @JsonSubTypes.Type(value = StructElement.class, name = StructElement.STRUCT),
        @JsonSubTypes.Type(value = InterfaceElement.class, name = InterfaceElement.INTERFACE),
        @JsonSubTypes.Type(value = MetaElement.class, name = MetaElement.META)
})
public sealed interface IdlElement permits CommentElement, EnumElement, StructElement, InterfaceElement, MetaElement {

    /**
     * The element variants and their {@code type} discriminator values.
     */
    enum Kind {
        COMMENT(CommentElement.COMMENT),
        ENUM(EnumElement.ENUM),
        STRUCT(StructElement.STRUCT),
        INTERFACE(InterfaceElement.INTERFACE),
        META(MetaElement.META);

        private final String type;

        Kind(String type) {
            this.type = type;
        }

        /**
         * Returns the discriminator as written in the IDL document.
         *
         * @return the {@code type} value
         */
        @JsonValue
        public String asString() {
            return type;
        }
    }

    /**
     * Returns the variant of this element.
     *
     * @return the element kind
     */
    @JsonIgnore
    Kind kind();
}
