package org.muma.respkv.command.impl;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.command.RedisContext;
import org.muma.respkv.command.RequestCursor;
import org.muma.respkv.command.RequestError;
import org.muma.respkv.command.RequestException;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.store.StorageEntry;

import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds]
 * <p>
 * 无条件覆盖旧值；没有带 TTL 子句时同时丢弃旧的过期时间。
 */
public class SetCommand implements RedisCommand {

    @Override
    public String name() {
        return "SET";
    }

    @Override
    public RedisMessage execute(RequestCursor cursor, RedisContext context) {
        String key = cursor.nextRequired("set");
        String value = cursor.nextRequired("set");

        long expireAt = StorageEntry.NO_EXPIRY;
        // 后面紧跟的不是新命令，就只能是 TTL 子句
        if (cursor.hasNext() && !cursor.nextIsCommand()) {
            String unit = cursor.next();
            String amount = cursor.nextRequired("set");
            expireAt = computeExpireAt(unit, amount, context);
        }

        context.getStorage().create(key, value, expireAt);
        return SimpleString.OK;
    }

    private long computeExpireAt(String unit, String amount, RedisContext context) {
        long multiplier = switch (unit.toUpperCase(Locale.ROOT)) {
            case "EX" -> 1000L; // 秒统一换算成毫秒
            case "PX" -> 1L;
            default -> throw new RequestException(RequestError.WRONG_ARG, "Wrong argument: " + unit);
        };

        long ttl;
        try {
            ttl = Long.parseLong(amount);
        } catch (NumberFormatException e) {
            throw new RequestException(RequestError.INTEGER_PARSE, "Couldn't parse '" + amount + "' to integer", e);
        }
        if (ttl <= 0) {
            throw new RequestException(RequestError.WRONG_ARG, "Wrong argument: invalid expire time " + ttl);
        }

        try {
            return Math.addExact(context.nowMillis(), Math.multiplyExact(ttl, multiplier));
        } catch (ArithmeticException e) {
            throw new RequestException(RequestError.WRONG_ARG, "Wrong argument: expire time " + ttl + " out of range", e);
        }
    }
}
