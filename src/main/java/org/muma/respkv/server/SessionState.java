package org.muma.respkv.server;

/**
 * 客户端会话状态
 * AWAITING_INPUT -> DISPATCHING -> WRITING -> AWAITING_INPUT 循环，
 * CLOSED (对端正常断开) 和 FAILED (IO 或协议错误) 为终态。
 */
public enum SessionState {
    AWAITING_INPUT,
    DISPATCHING,
    WRITING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
