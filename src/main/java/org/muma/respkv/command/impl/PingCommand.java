package org.muma.respkv.command.impl;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.command.RedisContext;
import org.muma.respkv.command.RequestCursor;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;

/**
 * PING [message]
 * <p>
 * 如果下一个单词本身是命令名，则认为 PING 没有参数 (那个单词开始一条新命令)。
 */
public class PingCommand implements RedisCommand {

    @Override
    public String name() {
        return "PING";
    }

    @Override
    public RedisMessage execute(RequestCursor cursor, RedisContext context) {
        if (cursor.hasNext() && !cursor.nextIsCommand()) {
            return new BulkString(cursor.next());
        }
        return SimpleString.PONG;
    }
}
