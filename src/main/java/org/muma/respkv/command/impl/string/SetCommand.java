package org.muma.respkv.command.impl.string;

import org.muma.respkv.command.RedisCommand;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;
import org.muma.respkv.store.StorageEngine;

/**
 * SET key value
 * <p>
 * 只支持最基本的形式，没有 NX/XX/EX/PX 选项。
 */
public class SetCommand implements RedisCommand {

    private static final SimpleString OK = new SimpleString("OK");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 3) {
            return errorArgs();
        }

        byte[] key = args.argBytes(1);
        byte[] value = args.argBytes(2);
        storage.set(key, value);
        return OK;
    }
}
