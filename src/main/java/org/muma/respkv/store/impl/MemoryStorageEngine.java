package org.muma.respkv.store.impl;

import org.muma.respkv.store.StorageEngine;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public class MemoryStorageEngine implements StorageEngine {

    // ConcurrentHashMap 的单 key 操作本身就是原子的，不需要额外加锁
    // ByteBuffer 的 equals/hashCode 按剩余内容计算，可以直接当二进制 key 用
    private final Map<ByteBuffer, byte[]> memoryDb = new ConcurrentHashMap<>();

    @Override
    public byte[] get(byte[] key) {
        Objects.requireNonNull(key, "key");
        return memoryDb.get(ByteBuffer.wrap(key));
    }

    @Override
    public void set(byte[] key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        // 拷贝一份，调用方之后改动数组不能影响已存入的 key
        memoryDb.put(ByteBuffer.wrap(key.clone()), value);
    }

    @Override
    public int size() {
        return memoryDb.size();
    }
}
