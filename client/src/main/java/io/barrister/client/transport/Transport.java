package io.barrister.client.transport;

import java.io.IOException;

/**
 * Carries an encoded request to a service and returns the encoded response.
 * <p>
 * A transport knows nothing about JSON-RPC; it exchanges opaque payloads. In-process
 * transports can hand the bytes straight to a server-side handler.
 */
@FunctionalInterface
public interface Transport {

    /**
     * Sends a request and waits for the response.
     *
     * @param request the encoded request
     * @return the encoded response
     * @throws IOException if the exchange fails
     */
    byte[] send(byte[] request) throws IOException;
}
