package org.muma.respkv.command;

import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;

public interface RedisCommand {

    // 执行命令，args 第 0 个元素是命令名本身
    RedisMessage execute(StorageEngine storage, RedisArray args);

    /**
     * 辅助工具：参数个数错误
     */
    default ErrorMessage errorArgs() {
        return new ErrorMessage("ERR wrong number of arguments");
    }
}
