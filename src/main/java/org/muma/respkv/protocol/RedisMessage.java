package org.muma.respkv.protocol;

/**
 * RESP 消息模型
 * 请求方向只会出现 RedisArray(BulkString...)，响应方向可能是任意一种。
 */
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {
}
