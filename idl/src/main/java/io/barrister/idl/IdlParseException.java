package io.barrister.idl;

/**
 * Thrown when an IDL document cannot be decoded. No partial model is ever exposed.
 */
public class IdlParseException extends Exception {

    public IdlParseException(final String msg) {
        super(msg);
    }

    public IdlParseException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
