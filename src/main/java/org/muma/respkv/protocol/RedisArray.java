package org.muma.respkv.protocol;

import java.util.Arrays;

// 5. 数组 (*) - 支持 null (表示 *-1)，元素可以任意嵌套
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray NULL = new RedisArray(null);

    public static RedisArray of(RedisMessage... elements) {
        return new RedisArray(elements);
    }

    public boolean isNull() {
        return elements == null;
    }

    @Override
    public RespType type() {
        return RespType.ARRAY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedisArray other)) return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "RedisArray[null]" : "RedisArray" + Arrays.toString(elements);
    }
}
