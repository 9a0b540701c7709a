package org.muma.respkv.command;

import org.muma.respkv.protocol.RedisMessage;

public interface RedisCommand {

    /**
     * 命令名 (大写)
     */
    String name();

    /**
     * 执行命令。调用时游标已越过命令名本身，命令自行消耗参数。
     */
    RedisMessage execute(RequestCursor cursor, RedisContext context);
}
