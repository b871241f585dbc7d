/**
 * Dispatch of JSON-RPC method calls to registered handlers.
 */
@NullMarked
package io.barrister.server.requesthandlers;

import org.jspecify.annotations.NullMarked;
