/**
 * HTTP client abstraction used by the Barrister HTTP transport, with a default
 * implementation on {@code java.net.http}.
 */
@NullMarked
package io.barrister.client.http;

import org.jspecify.annotations.NullMarked;
