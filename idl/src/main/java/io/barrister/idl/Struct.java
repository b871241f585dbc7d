package io.barrister.idl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.barrister.spec.Field;
import org.jspecify.annotations.Nullable;

/**
 * A struct of the contract model together with its resolved field set.
 * <p>
 * {@code resolvedFields} merges the struct's own fields with every field inherited through
 * its {@code extends} chain, keyed by field name. A field declared closer to the struct
 * replaces an inherited field of the same name. Inherited fields come first, in ancestor
 * order, followed by the struct's own fields.
 *
 * @param name the struct name
 * @param extendsName the declared parent, or {@code null}
 * @param fields the struct's own fields
 * @param resolvedFields own and inherited fields by name
 */
public record Struct(String name, @Nullable String extendsName, List<Field> fields, Map<String, Field> resolvedFields) {

    public Struct {
        fields = List.copyOf(fields);
        resolvedFields = Collections.unmodifiableMap(new LinkedHashMap<>(resolvedFields));
    }

    /**
     * Looks up a field of the resolved field set.
     *
     * @param fieldName the field name
     * @return the field, or {@code null} if neither the struct nor an ancestor declares it
     */
    public @Nullable Field field(String fieldName) {
        return resolvedFields.get(fieldName);
    }
}
