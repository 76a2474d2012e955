package org.muma.respkv.command.impl.connection;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;

/**
 * ECHO message
 */
public class EchoCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 2) {
            return errorArgs();
        }
        return new BulkString(args.argBytes(1));
    }
}
