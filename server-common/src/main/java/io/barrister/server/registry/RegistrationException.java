package io.barrister.server.registry;

/**
 * Thrown when a handler cannot be registered because it does not implement its IDL
 * interface: the interface is unknown, a function is missing, or a signature does not
 * match the declared types.
 * <p>
 * This is a configuration error. It is raised at startup, never while serving a request.
 */
public class RegistrationException extends RuntimeException {

    public RegistrationException(final String msg) {
        super(msg);
    }

    public RegistrationException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
