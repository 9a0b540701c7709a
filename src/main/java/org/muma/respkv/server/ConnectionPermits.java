package org.muma.respkv.server;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 全局连接名额池。启动时创建一次，接入时取走一个名额，连接结束时归还。
 */
public class ConnectionPermits {

    private final Semaphore semaphore;
    private volatile boolean closed;

    public ConnectionPermits(int maxConnections) {
        this.semaphore = new Semaphore(maxConnections);
    }

    /**
     * 在超时时间内获取一个名额
     *
     * @throws AdmissionException 超时、已关闭，或者等待时线程被中断
     */
    public void acquire(long timeoutMillis) throws AdmissionException {
        if (closed) {
            throw new AdmissionException(AdmissionException.Reason.CLOSED, "Connection permit pool is closed");
        }
        try {
            if (!semaphore.tryAcquire(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new AdmissionException(AdmissionException.Reason.TIMEOUT,
                        "Timed out waiting for a connection permit (" + timeoutMillis + " ms)");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdmissionException(AdmissionException.Reason.CLOSED, "Interrupted waiting for a connection permit", e);
        }
        // 等待期间被关闭
        if (closed) {
            semaphore.release();
            throw new AdmissionException(AdmissionException.Reason.CLOSED, "Connection permit pool is closed");
        }
    }

    public void release() {
        semaphore.release();
    }

    public int available() {
        return semaphore.availablePermits();
    }

    /**
     * 关闭名额池。正在等待的线程会被唤醒并以 CLOSED 失败，不必等到超时。
     */
    public void close() {
        closed = true;
        // 多放一个名额：被唤醒的等待者看到 closed 后会把名额还回去，依次唤醒下一个
        semaphore.release();
    }

    public boolean isClosed() {
        return closed;
    }
}
