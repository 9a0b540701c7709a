package org.muma.respkv.command.impl;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.command.RedisContext;
import org.muma.respkv.command.RequestCursor;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.StorageEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET key
 * <p>
 * 惰性删除 (Lazy Expiration)：读到已过期的 Key 时回复 nil，随后在写锁下删除。
 */
public class GetCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(GetCommand.class);

    @Override
    public String name() {
        return "GET";
    }

    @Override
    public RedisMessage execute(RequestCursor cursor, RedisContext context) {
        String key = cursor.nextRequired("get");
        StorageEngine storage = context.getStorage();

        StorageEntry entry = storage.read(key);
        if (entry == null) {
            return BulkString.NULL; // Nil
        }
        if (!entry.hasExpiry()) {
            return new BulkString(entry.getValue());
        }

        long now = context.nowMillis();
        if (!entry.isExpiredAt(now)) {
            return new BulkString(entry.getValue());
        }

        expire(storage, key, now);
        return BulkString.NULL;
    }

    // 读锁释放后到拿到写锁之间，其它连接可能已经重新 SET 过，删除前再检查一次
    private void expire(StorageEngine storage, String key, long now) {
        storage.getLock().writeLock().lock();
        try {
            StorageEntry current = storage.read(key);
            if (current != null && current.isExpiredAt(now)) {
                storage.delete(key);
                log.debug("Lazy expiration removed key '{}'", key);
            }
        } finally {
            storage.getLock().writeLock().unlock();
        }
    }
}
