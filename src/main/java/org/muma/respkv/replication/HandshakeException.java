package org.muma.respkv.replication;

import lombok.Getter;

/**
 * 握手在某一步失败，整次握手终止，不重试
 */
@Getter
public class HandshakeException extends RuntimeException {

    private final ReplState step;

    public HandshakeException(ReplState step, String reason, Throwable cause) {
        super("replication handshake failed at " + step + ": " + reason, cause);
        this.step = step;
    }
}
