package org.muma.respkv.store.impl;

import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.StorageEntry;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class MemoryStorageEngine implements StorageEngine {

    // 1. 数据存储 (Key -> Value)
    private final Map<String, String> memoryDb = new HashMap<>();

    // 2. 过期时间存储 (Key -> ExpireAt Timestamp)
    // 只记录设置了 TTL 的 Key，清理线程只需要扫描这张表
    private final Map<String, Long> ttlMap = new HashMap<>();

    // 两张表共用一把锁，写任意一张表都视为写整个存储
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void create(String key, String value, long expireAt) {
        lock.writeLock().lock();
        try {
            memoryDb.put(key, value);
            // 有过期时间则记录；没有则移除 (SET 总是丢弃旧的 TTL)
            if (expireAt != StorageEntry.NO_EXPIRY) {
                ttlMap.put(key, expireAt);
            } else {
                ttlMap.remove(key);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public StorageEntry read(String key) {
        lock.readLock().lock();
        try {
            String value = memoryDb.get(key);
            if (value == null) return null;
            Long expireAt = ttlMap.get(key);
            return new StorageEntry(value, expireAt == null ? StorageEntry.NO_EXPIRY : expireAt);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        lock.writeLock().lock();
        try {
            ttlMap.remove(key); // 记得同步移除 TTL
            return memoryDb.remove(key) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, Long> expirySnapshot() {
        lock.readLock().lock();
        try {
            return new HashMap<>(ttlMap);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return memoryDb.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ReadWriteLock getLock() {
        return lock;
    }
}
