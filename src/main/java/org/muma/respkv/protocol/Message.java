package org.muma.respkv.protocol;

/**
 * 一次解码的结果：类型标识 + 值
 *
 * @param type 产生该值的类型字节，主要用于校验
 * @param data 解码出的值
 */
public record Message(RespType type, RedisMessage data) {
}
