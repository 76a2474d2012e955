package org.muma.respkv.protocol;

// 2. 错误 (-)
public record ErrorMessage(String content) implements RedisMessage {
}
