package org.example.assignment.service.cache;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Byte-bounded in-memory store. Least-recently-used entries are evicted to stay within the
 * entry cap and the total byte quota; only values over the per-entry limit are refused.
 */
public class InMemoryCacheStore implements CacheStore {

    private final int maxEntries;
    private final long maxEntryBytes;
    private final long maxTotalBytes;
    private final LinkedHashMap<String, String> entries;
    private long totalBytes;

    public InMemoryCacheStore(int maxEntries, long maxEntryBytes, long maxTotalBytes) {
        this.maxEntries = Math.max(1, maxEntries);
        this.maxEntryBytes = Math.max(1, maxEntryBytes);
        this.maxTotalBytes = Math.max(this.maxEntryBytes, maxTotalBytes);
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void put(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new CacheWriteException("Cache key must not be blank");
        }
        long size = sizeOf(key, value);
        if (size > maxEntryBytes) {
            throw new CacheWriteException("Entry '" + key + "' is " + size + " bytes, limit is " + maxEntryBytes);
        }
        remove(key);
        evictUntil(maxEntries - 1, maxTotalBytes - size);

        entries.put(key, value);
        totalBytes += size;
    }

    @Override
    public synchronized void remove(String key) {
        String removed = entries.remove(key);
        if (removed != null) {
            totalBytes -= sizeOf(key, removed);
        }
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        totalBytes = 0;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getTotalBytes() {
        return totalBytes;
    }

    private void evictUntil(int entryLimit, long byteLimit) {
        var iterator = entries.entrySet().iterator();
        while ((entries.size() > entryLimit || totalBytes > byteLimit) && iterator.hasNext()) {
            Map.Entry<String, String> eldest = iterator.next();
            totalBytes -= sizeOf(eldest.getKey(), eldest.getValue());
            iterator.remove();
        }
    }

    private static long sizeOf(String key, String value) {
        long valueBytes = value == null ? 0 : value.getBytes(StandardCharsets.UTF_8).length;
        return key.getBytes(StandardCharsets.UTF_8).length + valueBytes;
    }
}
