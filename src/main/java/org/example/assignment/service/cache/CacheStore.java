package org.example.assignment.service.cache;

import java.util.Optional;

/**
 * String key-value storage underneath {@link TtlCache}.
 */
public interface CacheStore {

    Optional<String> get(String key);

    /**
     * @throws CacheWriteException if the store cannot hold the value (size bound, quota)
     */
    void put(String key, String value);

    void remove(String key);

    void clear();

    int size();
}
