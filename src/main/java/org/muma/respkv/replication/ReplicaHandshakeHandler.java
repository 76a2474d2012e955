package org.muma.respkv.replication;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import org.muma.respkv.protocol.RedisMessage;

/**
 * 从节点连接 Master 的 Netty Handler
 * 握手阶段把解码后的回复交给状态机；握手完成、解码器被移除后收到的是原始 ByteBuf，只统计字节数。
 */
public class ReplicaHandshakeHandler extends ChannelInboundHandlerAdapter {

    private final ReplicationHandshake handshake;

    public ReplicaHandshakeHandler(ReplicationHandshake handshake) {
        this.handshake = handshake;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof RedisMessage reply) {
            handshake.onReply(reply);
        } else if (msg instanceof ByteBuf buf) {
            handshake.onStreamBytes(buf.readableBytes());
            buf.release();
        } else {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        handshake.onDisconnected();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        handshake.onError(cause);
    }
}
