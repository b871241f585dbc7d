/**
 * Explicit binding tables between IDL functions and handler callables.
 */
@NullMarked
package io.barrister.server.binding;

import org.jspecify.annotations.NullMarked;
