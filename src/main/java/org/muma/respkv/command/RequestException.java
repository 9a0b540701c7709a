package org.muma.respkv.command;

import lombok.Getter;

/**
 * 请求处理失败。连接层收到后中止当前连接，不做重新同步。
 */
@Getter
public class RequestException extends RuntimeException {

    private final RequestError error;

    public RequestException(RequestError error, String message) {
        super(message);
        this.error = error;
    }

    public RequestException(RequestError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
