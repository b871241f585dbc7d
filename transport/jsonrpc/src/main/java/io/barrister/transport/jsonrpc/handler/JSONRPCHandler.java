package io.barrister.transport.jsonrpc.handler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.barrister.idl.Idl;
import io.barrister.server.requesthandlers.RequestHandler;
import io.barrister.spec.InternalError;
import io.barrister.spec.InvalidRequestError;
import io.barrister.spec.JSONParseError;
import io.barrister.spec.JSONRPCError;
import io.barrister.spec.JsonRpcRequest;
import io.barrister.spec.JsonRpcResponse;
import io.barrister.util.Assert;
import io.barrister.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 envelope handling on top of a {@link RequestHandler}.
 * <p>
 * {@link #invoke(byte[])} takes a raw request payload and returns the raw response payload.
 * The first significant character of the payload selects the shape:
 * <ul>
 *   <li>an object - a single request, answered by a single response</li>
 *   <li>an array - a batch, answered by an array with one response per request, in request order</li>
 *   <li>anything else, or a payload that does not decode - a parse error response with a {@code null} id</li>
 * </ul>
 * An empty batch is answered by an empty array.
 *
 * <h2>Introspection</h2>
 * The reserved method {@value #IDL_METHOD} bypasses the handlers and returns the IDL
 * document as it was loaded, so that clients can fetch the contract at runtime:
 * <pre>{@code
 * {"jsonrpc": "2.0", "id": "1", "method": "barrister-idl"}
 * }</pre>
 *
 * <h2>Parameters</h2>
 * An array {@code params} is spread into positional arguments. Any other value is passed as
 * the single argument; a missing {@code params} is passed as a single {@code null}, which only
 * a function with one optional parameter accepts. Send {@code []} to call a function without
 * parameters.
 */
public class JSONRPCHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCHandler.class);

    /**
     * The reserved method that returns the IDL document.
     */
    public static final String IDL_METHOD = Idl.IDL_METHOD;

    private static final TypeReference<List<JsonRpcRequest>> BATCH_TYPE_REFERENCE = new TypeReference<>() {};

    private final RequestHandler requestHandler;
    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    public JSONRPCHandler(RequestHandler requestHandler) {
        this(requestHandler, false);
    }

    /**
     * Creates a handler.
     *
     * @param requestHandler the dispatcher
     * @param forceAscii whether responses escape every non-ASCII character as {@code \}{@code uXXXX}
     */
    public JSONRPCHandler(RequestHandler requestHandler, boolean forceAscii) {
        this(requestHandler, Utils.OBJECT_MAPPER, forceAscii);
    }

    public JSONRPCHandler(RequestHandler requestHandler, ObjectMapper objectMapper, boolean forceAscii) {
        this.requestHandler = Assert.checkNotNullParam("requestHandler", requestHandler);
        this.objectMapper = Assert.checkNotNullParam("objectMapper", objectMapper);
        this.writer = forceAscii
                ? objectMapper.writer().with(JsonWriteFeature.ESCAPE_NON_ASCII)
                : objectMapper.writer();
    }

    /**
     * Handles a request payload.
     *
     * @param payload the UTF-8 request, a single request object or a batch array
     * @return the UTF-8 response
     */
    public byte[] invoke(byte[] payload) {
        Assert.checkNotNullParam("payload", payload);
        return write(handle(payload));
    }

    /**
     * Handles a request payload.
     *
     * @param payload the request, a single request object or a batch array
     * @return the response
     */
    public String invoke(String payload) {
        Assert.checkNotNullParam("payload", payload);
        return new String(invoke(payload.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
    }

    private JsonNode handle(byte[] payload) {
        switch (firstSignificantChar(payload)) {
            case '{': {
                JsonRpcRequest request;
                try {
                    request = objectMapper.readValue(payload, JsonRpcRequest.class);
                } catch (IOException e) {
                    return parseError(e);
                }
                return encode(invokeOne(request));
            }
            case '[': {
                List<JsonRpcRequest> requests;
                try {
                    requests = objectMapper.readValue(payload, BATCH_TYPE_REFERENCE);
                } catch (IOException e) {
                    return parseError(e);
                }
                ArrayNode responses = objectMapper.createArrayNode();
                for (JsonRpcRequest request : requests) {
                    responses.add(encode(invokeOne(request)));
                }
                return responses;
            }
            default:
                LOGGER.debug("Payload is neither a JSON object nor an array");
                return encode(JsonRpcResponse.failure(null, new JSONParseError("Unable to parse request JSON")));
        }
    }

    private JsonNode parseError(IOException e) {
        LOGGER.debug("Unable to decode request: {}", e.getMessage());
        return encode(JsonRpcResponse.failure(null, new JSONParseError("Unable to parse request JSON: " + e.getMessage())));
    }

    private static int firstSignificantChar(byte[] payload) {
        int offset = 0;
        // UTF-8 byte order mark
        if (payload.length >= 3 && (payload[0] & 0xFF) == 0xEF && (payload[1] & 0xFF) == 0xBB && (payload[2] & 0xFF) == 0xBF) {
            offset = 3;
        }
        for (int i = offset; i < payload.length; i++) {
            byte b = payload[i];
            if (b != ' ' && b != '\t' && b != '\n' && b != '\r') {
                return b;
            }
        }
        return -1;
    }

    /**
     * Handles one decoded request.
     *
     * @param request the request
     * @return the response, carrying the request id and either a result or an error
     */
    public JsonRpcResponse invokeOne(JsonRpcRequest request) {
        Assert.checkNotNullParam("request", request);
        Object id = request.id();
        String method = request.method();
        if (method == null) {
            return JsonRpcResponse.failure(id, new InvalidRequestError("Request has no method"));
        }

        if (IDL_METHOD.equals(method)) {
            return JsonRpcResponse.success(id, requestHandler.idl().document());
        }

        try {
            return JsonRpcResponse.success(id, requestHandler.call(method, arguments(request.params())));
        } catch (JSONRPCError e) {
            return JsonRpcResponse.failure(id, e);
        }
    }

    private static @Nullable Object[] arguments(@Nullable Object params) {
        if (params instanceof List<?> list) {
            return list.toArray();
        }
        return new Object[] {params};
    }

    private JsonNode encode(JsonRpcResponse response) {
        try {
            return objectMapper.valueToTree(response);
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Unable to serialize response for request {}", response.id(), e);
            return objectMapper.valueToTree(JsonRpcResponse.failure(response.id(),
                    new InternalError("Unable to serialize result: " + e.getMessage())));
        }
    }

    private byte[] write(JsonNode node) {
        try {
            return writer.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            // a tree of plain nodes always serializes
            throw new IllegalStateException("Unable to write response", e);
        }
    }
}
