package com.anonrelay.model;

/**
 * Mints identifiers for anonymous threads. Ids start with {@code #}; uniqueness is only
 * required per owning actor and is checked by the receiving side.
 */
@FunctionalInterface
public interface ThreadIdGenerator {

    String nextId();
}
