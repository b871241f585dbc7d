package io.barrister.idl;

/**
 * Thrown when the IDL itself is defective, for example a field referencing a type name that
 * is neither a primitive nor a declared struct or enum.
 * <p>
 * A SchemaException indicates a misconfigured process, not a bad request: it is never
 * converted to a JSON-RPC error response and should abort the operation that raised it.
 */
public class SchemaException extends RuntimeException {

    public SchemaException(final String msg) {
        super(msg);
    }
}
