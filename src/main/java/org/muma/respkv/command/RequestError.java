package org.muma.respkv.command;

/**
 * 请求层错误分类
 */
public enum RequestError {
    INPUT_TOO_SHORT,
    CRLF_NOT_AT_END,
    NULL_ARRAY,
    NOT_ARRAY,
    EMPTY_ARRAY,
    NOT_ALL_BULK,
    MISSING_ARG,
    WRONG_ARG,
    INVALID_UTF8,
    INTEGER_PARSE,
    CLOCK,
    // 帧解析失败，原始 RespException 作为 cause
    PROTOCOL
}
