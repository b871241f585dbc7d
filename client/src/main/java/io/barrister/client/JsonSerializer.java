package io.barrister.client;

import java.io.IOException;

import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.barrister.util.Assert;
import io.barrister.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A {@link Serializer} for JSON, backed by Jackson.
 * <p>
 * With {@code forceAscii} every non-ASCII character of the output is escaped as
 * {@code \}{@code uXXXX}, for services that cannot decode UTF-8.
 */
public class JsonSerializer implements Serializer {

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final boolean forceAscii;

    public JsonSerializer() {
        this(false);
    }

    public JsonSerializer(boolean forceAscii) {
        this(Utils.OBJECT_MAPPER, forceAscii);
    }

    public JsonSerializer(ObjectMapper objectMapper, boolean forceAscii) {
        this.objectMapper = Assert.checkNotNullParam("objectMapper", objectMapper);
        this.forceAscii = forceAscii;
        this.writer = forceAscii
                ? objectMapper.writer().with(JsonWriteFeature.ESCAPE_NON_ASCII)
                : objectMapper.writer();
    }

    public boolean isForceAscii() {
        return forceAscii;
    }

    @Override
    public byte[] marshal(Object value) throws IOException {
        return writer.writeValueAsBytes(value);
    }

    @Override
    public <T> T unmarshal(byte[] data, TypeReference<T> type) throws IOException {
        return objectMapper.readValue(data, type);
    }

    @Override
    public <T> @Nullable T convert(@Nullable Object value, Class<T> type) {
        return objectMapper.convertValue(value, type);
    }
}
