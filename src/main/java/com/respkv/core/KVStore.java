package com.respkv.core;

import java.util.Optional;

/**
 * Core storage interface for the key-value store.
 * All implementations must be thread-safe: a single instance is shared by
 * every client connection.
 */
public interface KVStore {

    /**
     * Store a value with no expiration, replacing any existing entry.
     *
     * @param key   the key to store
     * @param value the value to store
     */
    void set(String key, byte[] value);

    /**
     * Store a value with the given TTL, replacing any existing entry.
     * Value and expiry are replaced together.
     *
     * @param key       the key to store
     * @param value     the value to store
     * @param ttlMillis time-to-live in milliseconds (0 for no expiration)
     */
    void set(String key, byte[] value, long ttlMillis);

    /**
     * Retrieve the entry for a given key.
     *
     * @param key the key to look up
     * @return the entry if found and not expired, empty otherwise
     */
    Optional<StoreEntry> get(String key);

    /**
     * Remove entries whose expiry has passed.
     * Never changes what {@link #get(String)} returns.
     *
     * @return the number of entries removed
     */
    int sweep();

    /**
     * Get the number of entries in the store.
     *
     * @return the number of non-expired entries
     */
    int size();

    /**
     * Clear all entries from the store.
     */
    void clear();
}
