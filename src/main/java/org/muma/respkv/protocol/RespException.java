package org.muma.respkv.protocol;

import lombok.Getter;

/**
 * RESP 帧格式错误。客户端输入不合法时抛出，不会影响进程。
 */
@Getter
public class RespException extends RuntimeException {

    private final RespError error;

    public RespException(RespError error, String message) {
        super(message);
        this.error = error;
    }
}
