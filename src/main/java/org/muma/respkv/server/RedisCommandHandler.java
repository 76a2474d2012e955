package org.muma.respkv.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.RespDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 客户端会话，每个连接一个实例。
 * <p>
 * 命令在该连接所属的 EventLoop 上按到达顺序执行，响应先 write，
 * 一批读完后在 channelReadComplete 统一 flush，所以管道化请求的响应顺序与请求顺序一致。
 * pendingWrites 记录尚未完成的写操作，终态且计数归零后会话才可以被回收。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisArray> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;
    private final AtomicInteger pendingWrites = new AtomicInteger();

    private volatile SessionState state = SessionState.AWAITING_INPUT;
    private boolean truncatedAtEof;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public static int connectedClients() {
        return connectedClients.get();
    }

    public SessionState state() {
        return state;
    }

    public int pendingWrites() {
        return pendingWrites.get();
    }

    /**
     * 已进入终态且没有未完成的写
     */
    public boolean isReleasable() {
        return state.isTerminal() && pendingWrites.get() == 0;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.incrementAndGet();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.decrementAndGet();
        if (!state.isTerminal()) {
            state = truncatedAtEof ? SessionState.FAILED : SessionState.CLOSED;
        }
        log.info("Client disconnected: {}, state: {}, total clients: {}",
                ctx.channel().remoteAddress(), state, total);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisArray command) {
        if (state.isTerminal()) {
            return;
        }

        state = SessionState.DISPATCHING;
        RedisMessage reply = dispatcher.dispatch(command);

        state = SessionState.WRITING;
        pendingWrites.incrementAndGet();
        ctx.write(reply).addListener((ChannelFutureListener) future -> {
            pendingWrites.decrementAndGet();
            if (!future.isSuccess() && !state.isTerminal()) {
                fail(ctx, future.cause());
            }
        });
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) {
        ctx.flush();
        if (!state.isTerminal()) {
            state = SessionState.AWAITING_INPUT;
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        // 写缓冲积压时暂停读取，避免客户端只管发不管收把内存撑爆
        ctx.channel().config().setAutoRead(ctx.channel().isWritable());
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == RespDecoder.DecoderEvent.TRUNCATED_FRAME) {
            truncatedAtEof = true;
        } else if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.READER_IDLE) {
            log.info("Client {} idle timeout, closing connection", ctx.channel().remoteAddress());
            state = SessionState.FAILED;
            ctx.close();
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        fail(ctx, cause);
    }

    private void fail(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            // 协议错误：不回复，之前已解析命令的响应照常发出后断开
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.flush();
        } else {
            log.warn("I/O error on connection {}", ctx.channel().remoteAddress(), cause);
        }
        state = SessionState.FAILED;
        ctx.close();
    }
}
