package org.muma.respkv.command;

import lombok.Getter;
import org.muma.respkv.store.StorageEngine;

import java.time.Clock;

/**
 * 命令执行上下文
 * 封装了命令执行需要的共享资源：存储引擎句柄和时钟
 */
@Getter
public class RedisContext {

    private final StorageEngine storage;
    private final Clock clock;

    public RedisContext(StorageEngine storage, Clock clock) {
        this.storage = storage;
        this.clock = clock;
    }

    /**
     * 当前时间 (ms since epoch)。时钟早于纪元视为时钟回拨，直接失败，不重试。
     */
    public long nowMillis() {
        long now = clock.millis();
        if (now < 0) {
            throw new RequestException(RequestError.CLOCK, "Clock may have gone backwards: " + now + "ms");
        }
        return now;
    }
}
