package io.barrister.client;

import java.util.List;

import io.barrister.spec.JSONRPCError;
import io.barrister.spec.JsonRpcRequest;
import io.barrister.spec.JsonRpcResponse;
import org.jspecify.annotations.Nullable;

/**
 * A client of a Barrister service.
 */
public interface Client {

    /**
     * Calls a remote method.
     *
     * @param method the qualified method name, {@code "Interface.function"}
     * @param params the positional parameters
     * @return the result, as decoded from JSON: a map, list, string, number, boolean or {@code null}
     * @throws JSONRPCError the error returned by the service, or a local failure to exchange the request
     */
    @Nullable Object call(String method, @Nullable Object... params) throws JSONRPCError;

    /**
     * Calls a remote method and converts its result.
     *
     * @param resultType the type to convert the result to
     * @param method the qualified method name, {@code "Interface.function"}
     * @param params the positional parameters
     * @param <T> the result type
     * @return the converted result
     * @throws JSONRPCError the error returned by the service, or a local failure to exchange the
     *         request or convert the result
     */
    <T> @Nullable T call(Class<T> resultType, String method, @Nullable Object... params) throws JSONRPCError;

    /**
     * Sends several requests in one exchange.
     * <p>
     * The service answers positionally. A failure to exchange the batch is reported as a
     * single error response.
     *
     * @param batch the requests
     * @return the responses
     */
    List<JsonRpcResponse> callBatch(List<JsonRpcRequest> batch);
}
