package org.muma.respkv.replication;

/**
 * 从节点握手状态，严格按声明顺序推进。
 * 除 CONNECTING 外，每个状态表示"对应命令已发出，正在等待它的回复"。
 */
public enum ReplState {
    CONNECTING,         // 解析地址并建立 TCP 连接
    PINGED,             // PING 已发送，等待 PONG
    CONFIGURED_PORT,    // REPLCONF listening-port 已发送
    CONFIGURED_CAPA,    // REPLCONF capa psync2 已发送
    SYNC_REQUESTED,     // PSYNC ? -1 已发送，等待 +FULLRESYNC / +CONTINUE
    COMPLETE,           // 握手完成，后续是复制数据流
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
