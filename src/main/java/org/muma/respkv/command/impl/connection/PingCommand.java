package org.muma.respkv.command.impl.connection;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.store.StorageEngine;

public class PingCommand implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 1) {
            return errorArgs();
        }
        return PONG;
    }
}
