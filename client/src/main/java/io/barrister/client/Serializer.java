package io.barrister.client;

import java.io.IOException;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;

/**
 * Codec between request and response objects and the bytes exchanged with a service.
 */
public interface Serializer {

    byte[] marshal(Object value) throws IOException;

    <T> T unmarshal(byte[] data, TypeReference<T> type) throws IOException;

    /**
     * Converts a decoded value, such as a call result, to a Java type.
     *
     * @param value the decoded value
     * @param type the target type
     * @param <T> the target type
     * @return the converted value
     * @throws IllegalArgumentException if the value cannot be converted
     */
    <T> @Nullable T convert(@Nullable Object value, Class<T> type);
}
