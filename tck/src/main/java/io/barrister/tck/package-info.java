/**
 * The Barrister conformance contract and reference implementations of its interfaces.
 *
 * <p>{@link io.barrister.tck.ConformanceIdl} loads {@code conform.json}, an IDL document that
 * exercises enums, struct inheritance, optional fields, arrays and every primitive type.
 * {@link io.barrister.tck.AImpl} and {@link io.barrister.tck.BImpl} implement its interfaces
 * {@code A} and {@code B} and are used by the test suites of the other modules.
 */
@NullMarked
package io.barrister.tck;

import org.jspecify.annotations.NullMarked;
