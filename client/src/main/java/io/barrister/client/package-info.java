/**
 * Client side of Barrister: calls remote methods over a pluggable {@link io.barrister.client.transport.Transport}.
 *
 * <pre>{@code
 * Client client = new RemoteClient(new HttpTransport("http://localhost:8080/rpc"));
 * String echoed = client.call(String.class, "B.echo", "hello");
 * }</pre>
 */
@NullMarked
package io.barrister.client;

import org.jspecify.annotations.NullMarked;
