package org.muma.respkv.protocol;

import io.netty.handler.codec.CorruptedFrameException;

/**
 * 协议错误：帧格式非法或超限。
 * 对产生它的连接是致命的，连接必须关闭，不做重新同步。
 */
public class RespProtocolException extends CorruptedFrameException {

    public RespProtocolException(String message) {
        super(message);
    }
}
