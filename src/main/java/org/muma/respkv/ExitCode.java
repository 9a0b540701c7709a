package org.muma.respkv;

import lombok.Getter;

/**
 * 进程退出码
 */
@Getter
public enum ExitCode {
    OK(0),
    // 无法监听关闭信号
    SHUTDOWN(-1);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }
}
