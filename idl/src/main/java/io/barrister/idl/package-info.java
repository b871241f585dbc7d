/**
 * The contract model: the parsed, indexed and immutable form of a Barrister IDL document.
 *
 * <p>{@link io.barrister.idl.Idl} is built once at startup, from bytes with
 * {@link io.barrister.idl.Idl#parse(byte[])} or from already decoded elements with
 * {@link io.barrister.idl.Idl#build(java.util.List)}, and is then only read. It can be shared
 * by any number of concurrent requests without synchronization.
 */
@NullMarked
package io.barrister.idl;

import org.jspecify.annotations.NullMarked;
