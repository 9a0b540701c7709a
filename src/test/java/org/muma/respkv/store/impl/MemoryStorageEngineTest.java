package org.muma.respkv.store.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.respkv.store.StorageEntry;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStorageEngineTest {

    private MemoryStorageEngine storage;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
    }

    @Test
    void testCreateAndRead() {
        assertNull(storage.read("missing"));

        storage.create("k", "v", StorageEntry.NO_EXPIRY);
        StorageEntry entry = storage.read("k");
        assertEquals("v", entry.getValue());
        assertFalse(entry.hasExpiry());
        assertEquals(1, storage.size());
    }

    @Test
    void testCreateWithExpiryRecordsTtl() {
        storage.create("k", "v", 5000L);
        assertEquals(5000L, storage.read("k").getExpireAt());
        assertEquals(Map.of("k", 5000L), storage.expirySnapshot());
    }

    @Test
    void testOverwriteWithoutExpiryDropsTtl() {
        storage.create("k", "v1", 5000L);
        storage.create("k", "v2", StorageEntry.NO_EXPIRY);

        assertEquals("v2", storage.read("k").getValue());
        assertFalse(storage.read("k").hasExpiry());
        assertTrue(storage.expirySnapshot().isEmpty());
    }

    @Test
    void testDeleteRemovesBothMaps() {
        storage.create("k", "v", 5000L);
        assertTrue(storage.delete("k"));
        assertNull(storage.read("k"));
        assertTrue(storage.expirySnapshot().isEmpty());
        assertEquals(0, storage.size());

        assertFalse(storage.delete("k"));
    }

    @Test
    void testSnapshotIsDetached() {
        storage.create("k", "v", 5000L);
        Map<String, Long> snapshot = storage.expirySnapshot();
        storage.delete("k");
        // 快照不随存储变化
        assertEquals(5000L, snapshot.get("k"));
    }

    @Test
    void testOperationsUnderHeldWriteLock() {
        // 锁可重入，调用方持有写锁时仍可以调用单个操作
        storage.getLock().writeLock().lock();
        try {
            storage.create("k", "v", 10L);
            assertNotNull(storage.read("k"));
            assertTrue(storage.delete("k"));
        } finally {
            storage.getLock().writeLock().unlock();
        }
        assertEquals(0, storage.size());
    }

    @Test
    void testEntryExpiryBoundary() {
        StorageEntry entry = new StorageEntry("v", 100L);
        assertFalse(entry.isExpiredAt(99));
        assertFalse(entry.isExpiredAt(100));
        assertTrue(entry.isExpiredAt(101));
        assertFalse(new StorageEntry("v", StorageEntry.NO_EXPIRY).isExpiredAt(Long.MAX_VALUE));
    }
}
