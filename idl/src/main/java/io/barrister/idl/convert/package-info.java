/**
 * Validation and conversion of untyped JSON values against IDL field types.
 */
@NullMarked
package io.barrister.idl.convert;

import org.jspecify.annotations.NullMarked;
