package org.muma.respkv.server;

import lombok.Getter;

/**
 * 连接准入失败：等待名额超时，或者名额池已关闭
 */
@Getter
public class AdmissionException extends Exception {

    public enum Reason {
        TIMEOUT, CLOSED
    }

    private final Reason reason;

    public AdmissionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AdmissionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
