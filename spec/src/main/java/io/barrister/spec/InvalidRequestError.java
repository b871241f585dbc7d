package io.barrister.spec;

import static io.barrister.spec.BarristerErrorCodes.INVALID_REQUEST_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * Error reported when a payload is valid JSON but not a valid JSON-RPC request.
 *
 * @see BarristerErrorCodes#INVALID_REQUEST_ERROR_CODE
 */
public class InvalidRequestError extends JSONRPCError {

    public InvalidRequestError() {
        this("Request payload validation error");
    }

    public InvalidRequestError(String message) {
        this(message, null);
    }

    public InvalidRequestError(String message, @Nullable Object data) {
        super(INVALID_REQUEST_ERROR_CODE, message, data);
    }
}
