package org.muma.respkv.protocol;

/**
 * 解码阶段 (帧层) 的错误分类
 */
public enum RespError {
    UNSUPPORTED_TYPE,
    CR_MISSING,
    LF_MISSING,
    // CR 后面没有紧跟 LF，或者 CR 之前出现了 LF
    CRLF_MISPLACED,
    NEGATIVE_LENGTH,
    INTEGER_PARSE,
    UNEXPECTED_END,
    NESTING_TOO_DEEP
}
