package org.muma.respkv.command.impl;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.command.RedisContext;
import org.muma.respkv.command.RequestCursor;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisMessage;

/**
 * ECHO message
 */
public class EchoCommand implements RedisCommand {

    @Override
    public String name() {
        return "ECHO";
    }

    @Override
    public RedisMessage execute(RequestCursor cursor, RedisContext context) {
        return new BulkString(cursor.nextRequired("echo"));
    }
}
