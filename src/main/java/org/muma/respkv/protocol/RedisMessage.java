package org.muma.respkv.protocol;

import java.nio.charset.StandardCharsets;

// 密封接口，限制实现类。Null Bulk String / Null Array 由 content/elements 为 null 表示
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {

    /**
     * 产生该值的 RESP 类型标识
     */
    RespType type();

    // 辅助方法：将字符串转为字节数组
    default byte[] toBytes(String content) {
        return content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8);
    }
}
