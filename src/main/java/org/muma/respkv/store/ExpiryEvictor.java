package org.muma.respkv.store;

import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 定期删除 (Active Expiration)
 * <p>
 * 独立的后台线程，每隔固定间隔对整个存储做一次全量扫描：
 * 持有写锁，遍历过期表快照，删除过期时间严格小于当前时间的 Key。
 * 与连接线程池完全隔离，扫描慢不会拖住网络 I/O。
 */
public class ExpiryEvictor {

    private static final Logger log = LoggerFactory.getLogger(ExpiryEvictor.class);

    private final StorageEngine storage;
    private final Clock clock;
    private final long intervalMillis;

    private final ScheduledExecutorService cleanupExecutor =
            Executors.newSingleThreadScheduledExecutor(new DefaultThreadFactory("expire-evictor", true));

    public ExpiryEvictor(StorageEngine storage, Clock clock, long intervalMillis) {
        this.storage = storage;
        this.clock = clock;
        this.intervalMillis = intervalMillis;
    }

    public void start() {
        // fixed delay: 扫描完成后再睡一个间隔
        cleanupExecutor.scheduleWithFixedDelay(this::runCycle, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.debug("Expiry evictor started, interval {}ms", intervalMillis);
    }

    public void shutdown() {
        cleanupExecutor.shutdownNow();
        log.debug("Expiry evictor stopped");
    }

    private void runCycle() {
        // 任务抛出异常会被 ScheduledExecutorService 静默取消，这里必须兜住
        try {
            evictExpired();
        } catch (RuntimeException e) {
            log.error("Expiry sweep failed", e);
        }
    }

    /**
     * 执行一轮扫描
     *
     * @return 本轮删除的 Key 数量
     */
    public int evictExpired() {
        long now = clock.millis();
        if (now < 0) {
            log.error("Clock may have gone backwards ({}ms), skipping expiry sweep", now);
            return 0;
        }

        int expiredCount = 0;
        storage.getLock().writeLock().lock();
        try {
            for (Map.Entry<String, Long> entry : storage.expirySnapshot().entrySet()) {
                if (entry.getValue() < now) {
                    storage.delete(entry.getKey());
                    expiredCount++;
                }
            }
        } finally {
            storage.getLock().writeLock().unlock();
        }

        if (expiredCount > 0) {
            log.debug("Active cleanup: expired {} keys, {} keys left", expiredCount, storage.size());
        }
        return expiredCount;
    }
}
