/**
 * JSON-RPC 2.0 request and response envelopes for Barrister services.
 */
@NullMarked
package io.barrister.transport.jsonrpc.handler;

import org.jspecify.annotations.NullMarked;
