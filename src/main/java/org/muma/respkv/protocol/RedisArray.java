package org.muma.respkv.protocol;

// 5. 数组 (*) - elements 为 null 表示 *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    /**
     * 第 index 个参数的字符串形式，命令参数一定是 BulkString
     */
    public String argString(int index) {
        return ((BulkString) elements[index]).asString();
    }

    public byte[] argBytes(int index) {
        return ((BulkString) elements[index]).content();
    }
}
