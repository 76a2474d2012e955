package org.muma.respkv.command.impl.string;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 2) {
            return errorArgs();
        }

        byte[] value = storage.get(args.argBytes(1));
        if (value == null) {
            return BulkString.NULL; // Nil
        }
        return new BulkString(value);
    }
}
