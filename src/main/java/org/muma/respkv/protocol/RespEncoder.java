package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import org.muma.respkv.utils.RespCodecUtil;

/**
 * RESP 编码器，无状态，可在多个连接间共享
 */
@ChannelHandler.Sharable
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    public static final RespEncoder INSTANCE = new RespEncoder();

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        RespCodecUtil.writeTo(out, msg);
    }
}
