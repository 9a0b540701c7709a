package org.muma.respkv.protocol;

// 1. 简单字符串 (+)
public record SimpleString(String content) implements RedisMessage {

    public static final SimpleString PONG = new SimpleString("PONG");
    public static final SimpleString OK = new SimpleString("OK");

    @Override
    public RespType type() {
        return RespType.SIMPLE_STRING;
    }
}
