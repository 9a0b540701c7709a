package org.muma.respkv.store;

import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * 存储引擎：主表 (key -> value) + 过期表 (key -> expireAt)
 * <p>
 * 过期表中的 key 必然存在于主表；不在过期表中的 key 永不过期。
 * 引擎本身不做过期判断，惰性删除由命令层负责，定期删除由 {@link ExpiryEvictor} 负责。
 * <p>
 * 单个 CRUD 操作自身是原子的；"先检查再删除" 之类的复合操作需要调用方持有 {@link #getLock()} 的写锁。
 */
public interface StorageEngine {

    /**
     * 无条件写入。expireAt 为 {@link StorageEntry#NO_EXPIRY} 时清除旧的过期时间。
     */
    void create(String key, String value, long expireAt);

    /**
     * @return 不存在时返回 null
     */
    StorageEntry read(String key);

    /**
     * 同时从两张表删除，不存在时什么也不做
     *
     * @return key 原本是否存在
     */
    boolean delete(String key);

    /**
     * 过期表的快照，遍历时可以安全地删除
     */
    Map<String, Long> expirySnapshot();

    int size();

    // 覆盖两张表的粗粒度读写锁，没有按 key 的分段锁
    ReadWriteLock getLock();
}
