package com.signalwatch.scan.cache;

import java.util.Optional;

/**
 * Flat key to bytes store. Keys are slash-separated relative paths.
 *
 * @throws CacheUnavailableException from any method when the backing store cannot be reached
 */
public interface ObjectStore {
    boolean exists(String key);

    Optional<byte[]> get(String key);

    void put(String key, byte[] content);
}
