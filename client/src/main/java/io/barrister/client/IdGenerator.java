package io.barrister.client;

/**
 * Source of JSON-RPC request ids.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();
}
