package org.muma.respkv.store;

import lombok.Data;

/**
 * 一次读取的结果：值 + 过期时间 (-1 表示不过期)
 */
@Data
public class StorageEntry {

    public static final long NO_EXPIRY = -1;

    private final String value;

    // 绝对过期时间戳 (ms since epoch)
    private final long expireAt;

    public boolean hasExpiry() {
        return expireAt != NO_EXPIRY;
    }

    public boolean isExpiredAt(long nowMillis) {
        return hasExpiry() && expireAt < nowMillis;
    }
}
