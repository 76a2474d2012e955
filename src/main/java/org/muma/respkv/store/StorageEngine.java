package org.muma.respkv.store;

/**
 * 键空间存储
 * 所有连接共享同一个实例，get/set 对同一个 key 原子可见，后完成的写覆盖先完成的写。
 * key 按原始字节比较，不做任何字符集解码。
 */
public interface StorageEngine {

    /**
     * @return 当前值，不存在返回 null
     */
    byte[] get(byte[] key);

    // 旧值直接丢弃
    void set(byte[] key, byte[] value);

    int size();
}
