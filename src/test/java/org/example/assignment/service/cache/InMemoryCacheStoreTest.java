package org.example.assignment.service.cache;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryCacheStoreTest {

    @Test
    void put_beyondEntryCap_evictsLeastRecentlyUsed() {
        InMemoryCacheStore store = new InMemoryCacheStore(2, 1024, 4096);
        store.put("a", "1");
        store.put("b", "2");
        store.get("a");

        store.put("c", "3");

        assertEquals(2, store.size());
        assertEquals(Optional.of("1"), store.get("a"));
        assertTrue(store.get("b").isEmpty());
        assertEquals(Optional.of("3"), store.get("c"));
    }

    @Test
    void put_entryOverLimit_throwsAndKeepsExistingEntries() {
        InMemoryCacheStore store = new InMemoryCacheStore(10, 8, 64);
        store.put("a", "1");

        assertThrows(CacheWriteException.class, () -> store.put("big", "0123456789"));
        assertEquals(Optional.of("1"), store.get("a"));
        assertEquals(1, store.size());
    }

    @Test
    void put_overTotalQuota_evictsLeastRecentlyUsedUntilValueFits() {
        InMemoryCacheStore store = new InMemoryCacheStore(10, 8, 20);
        store.put("a", "1234567");
        store.put("b", "1234567");
        store.get("a");

        store.put("c", "1234567");

        assertEquals(2, store.size());
        assertTrue(store.get("b").isEmpty());
        assertEquals(Optional.of("1234567"), store.get("a"));
        assertEquals(Optional.of("1234567"), store.get("c"));
        assertEquals(16, store.getTotalBytes());
    }

    @Test
    void put_replacingValue_accountsOnlyNewSize() {
        InMemoryCacheStore store = new InMemoryCacheStore(10, 16, 16);
        store.put("a", "123456789");

        store.put("a", "12345678901");

        assertEquals(12, store.getTotalBytes());
    }

    @Test
    void put_blankKey_throws() {
        InMemoryCacheStore store = new InMemoryCacheStore(10, 16, 16);

        assertThrows(CacheWriteException.class, () -> store.put(" ", "x"));
    }

    @Test
    void remove_releasesBytes() {
        InMemoryCacheStore store = new InMemoryCacheStore(10, 16, 32);
        store.put("a", "123");

        store.remove("a");

        assertEquals(0, store.getTotalBytes());
        assertTrue(store.get("a").isEmpty());
    }
}
