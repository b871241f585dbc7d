package io.barrister.server.requesthandlers;

import io.barrister.idl.Idl;
import io.barrister.spec.JSONRPCError;
import org.jspecify.annotations.Nullable;

/**
 * Dispatches a method call to the handler registered for its interface.
 */
public interface RequestHandler {

    /**
     * Calls a method.
     *
     * @param method the qualified method name, {@code "Interface.function"}
     * @param params the positional parameters, as decoded from JSON
     * @return the handler's result
     * @throws JSONRPCError if the call fails; the error carries the JSON-RPC code to report
     */
    @Nullable Object call(String method, @Nullable Object... params) throws JSONRPCError;

    /**
     * Returns the contract model this handler serves.
     *
     * @return the contract model
     */
    Idl idl();
}
