package io.barrister.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.barrister.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC response envelope.
 * <p>
 * Exactly one of {@code result} and {@code error} is present on the wire: an error
 * response carries {@code error}, every other response carries {@code result}, which
 * may be {@code null}.
 *
 * @param jsonrpc the protocol version, {@code "2.0"}
 * @param id the id of the request this response answers
 * @param result the call result, meaningful only when {@code error} is {@code null}
 * @param error the call error, or {@code null} on success
 */
@JsonSerialize(using = JsonRpcResponseSerializer.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(String jsonrpc, @Nullable Object id, @Nullable Object result, @Nullable JSONRPCError error) {

    public JsonRpcResponse {
        jsonrpc = Utils.defaultIfNull(jsonrpc, Utils.JSONRPC_VERSION);
        if (error != null) {
            result = null;
        }
    }

    /**
     * Creates a successful response.
     *
     * @param id the request id
     * @param result the result, may be {@code null}
     * @return the response
     */
    public static JsonRpcResponse success(@Nullable Object id, @Nullable Object result) {
        return new JsonRpcResponse(Utils.JSONRPC_VERSION, id, result, null);
    }

    /**
     * Creates an error response.
     *
     * @param id the request id, {@code null} when it could not be determined
     * @param error the error
     * @return the response
     */
    public static JsonRpcResponse failure(@Nullable Object id, JSONRPCError error) {
        return new JsonRpcResponse(Utils.JSONRPC_VERSION, id, null, error);
    }

    /**
     * Returns whether this response carries an error.
     *
     * @return {@code true} if {@code error} is set
     */
    public boolean hasError() {
        return error != null;
    }
}
