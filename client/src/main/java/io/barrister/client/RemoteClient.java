package io.barrister.client;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import io.barrister.client.transport.Transport;
import io.barrister.idl.Idl;
import io.barrister.idl.IdlParseException;
import io.barrister.spec.InternalError;
import io.barrister.spec.InvalidRequestError;
import io.barrister.spec.JSONRPCError;
import io.barrister.spec.JsonRpcRequest;
import io.barrister.spec.JsonRpcResponse;
import io.barrister.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Client} that encodes calls as JSON-RPC requests and sends them over a
 * {@link Transport}.
 * <p>
 * Local failures are reported the same way as remote ones, as a {@link JSONRPCError}:
 * <ul>
 *   <li>the request cannot be encoded: {@link InvalidRequestError}</li>
 *   <li>the transport fails: {@link InternalError}</li>
 *   <li>the response cannot be decoded: {@link InternalError}</li>
 * </ul>
 * The client does not check parameters or results against the IDL; the service does.
 */
public class RemoteClient implements Client {

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteClient.class);

    private static final TypeReference<JsonRpcResponse> RESPONSE = new TypeReference<>() {
    };
    private static final TypeReference<List<JsonRpcResponse>> BATCH_RESPONSE = new TypeReference<>() {
    };

    static final String BATCH = "batch";

    private final Transport transport;
    private final Serializer serializer;
    private final IdGenerator idGenerator;

    public RemoteClient(Transport transport) {
        this(transport, new JsonSerializer(), new RandomIdGenerator());
    }

    public RemoteClient(Transport transport, Serializer serializer, IdGenerator idGenerator) {
        this.transport = Assert.checkNotNullParam("transport", transport);
        this.serializer = Assert.checkNotNullParam("serializer", serializer);
        this.idGenerator = Assert.checkNotNullParam("idGenerator", idGenerator);
    }

    @Override
    public @Nullable Object call(String method, @Nullable Object... params) throws JSONRPCError {
        Assert.checkNotNullParam("method", method);
        List<@Nullable Object> args = params == null ? Collections.emptyList() : Arrays.asList(params);
        JsonRpcRequest request = new JsonRpcRequest(idGenerator.nextId(), method, args);
        JsonRpcResponse response = exchange(method, request, RESPONSE);
        if (response.error() != null) {
            LOGGER.debug("Call to {} failed with code {}: {}", method, response.error().getCode(), response.error().getMessage());
            throw response.error();
        }
        return response.result();
    }

    @Override
    public <T> @Nullable T call(Class<T> resultType, String method, @Nullable Object... params) throws JSONRPCError {
        Assert.checkNotNullParam("resultType", resultType);
        Object result = call(method, params);
        try {
            return serializer.convert(result, resultType);
        } catch (IllegalArgumentException e) {
            throw new InternalError("barrister: " + method + ": Unable to convert result to "
                    + resultType.getName() + ": " + e.getMessage());
        }
    }

    @Override
    public List<JsonRpcResponse> callBatch(List<JsonRpcRequest> batch) {
        Assert.checkNotNullParam("batch", batch);
        try {
            return exchange(BATCH, batch, BATCH_RESPONSE);
        } catch (JSONRPCError e) {
            return List.of(JsonRpcResponse.failure(null, e));
        }
    }

    /**
     * Fetches the IDL the service was built from, using the {@value Idl#IDL_METHOD}
     * introspection method.
     *
     * @return the service IDL
     * @throws JSONRPCError if the call fails
     * @throws IdlParseException if the service returned an invalid IDL
     */
    public Idl fetchIdl() throws IdlParseException {
        Object elements = call(Idl.IDL_METHOD);
        byte[] json;
        try {
            json = serializer.marshal(elements);
        } catch (IOException e) {
            throw new IdlParseException("Unable to re-encode the IDL returned by the service", e);
        }
        return Idl.parse(json);
    }

    private <T> T exchange(String method, Object request, TypeReference<T> responseType) {
        byte[] requestBytes;
        try {
            requestBytes = serializer.marshal(request);
        } catch (IOException e) {
            throw new InvalidRequestError("barrister: " + method + ": Call unable to Marshal request: " + e.getMessage());
        }

        LOGGER.debug("Sending {} ({} bytes)", method, requestBytes.length);
        byte[] responseBytes;
        try {
            responseBytes = transport.send(requestBytes);
        } catch (IOException e) {
            throw new InternalError("barrister: " + method + ": Transport error during request: " + e.getMessage());
        }

        try {
            return serializer.unmarshal(responseBytes, responseType);
        } catch (IOException e) {
            throw new InternalError("barrister: " + method + ": Call unable to Unmarshal response: " + e.getMessage());
        }
    }
}
