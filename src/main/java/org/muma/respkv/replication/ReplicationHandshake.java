package org.muma.respkv.replication;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.ScheduledFuture;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.RespDecoder;
import org.muma.respkv.protocol.RespEncoder;
import org.muma.respkv.protocol.SimpleString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.muma.respkv.utils.RespCodecUtil.command;

/**
 * 从节点握手状态机
 * <p>
 * 连接 Master 后依次执行 PING → REPLCONF listening-port → REPLCONF capa psync2 → PSYNC ? -1，
 * 每条命令单独发送并等待自己的回复。所有回调都在连接所属的 EventLoop 上执行，
 * {@link #onReply} 是唯一的推进入口。任何一步失败都直接进入 FAILED，
 * 通过 {@link #start()} 返回的 Future 报告失败的步骤和原因。
 */
public class ReplicationHandshake {

    private static final Logger log = LoggerFactory.getLogger(ReplicationHandshake.class);

    static final String DECODER_NAME = "respDecoder";

    private final LeaderAddress leader;
    private final int listeningPort;
    private final long stepTimeoutMillis;
    private final EventLoopGroup group;

    private final ReplicationMetadata metadata;
    private final CompletableFuture<ReplicationMetadata> result = new CompletableFuture<>();
    private final List<ReplState> transitions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean();

    private volatile ReplState state;
    private volatile ReplState failedStep;

    private volatile Channel masterChannel;
    // 本地主动 close()，之后的断开不算 Master 的问题
    private volatile boolean closingLocally;
    private ScheduledFuture<?> stepTimer;

    public ReplicationHandshake(LeaderAddress leader, int listeningPort, long stepTimeoutMillis, EventLoopGroup group) {
        this.leader = leader;
        this.listeningPort = listeningPort;
        this.stepTimeoutMillis = stepTimeoutMillis;
        this.group = group;
        this.metadata = new ReplicationMetadata(leader);
    }

    public ReplState state() {
        return state;
    }

    /**
     * @return 失败发生在哪一步，未失败时为 null
     */
    public ReplState failedStep() {
        return failedStep;
    }

    public List<ReplState> transitions() {
        return List.copyOf(transitions);
    }

    public ReplicationMetadata metadata() {
        return metadata;
    }

    public CompletableFuture<ReplicationMetadata> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("handshake already started");
        }

        transition(ReplState.CONNECTING);
        log.info("Connecting to master {} ...", leader);

        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(stepTimeoutMillis, Integer.MAX_VALUE))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(DECODER_NAME, new RespDecoder(RespDecoder.Mode.REPLY))
                                .addLast(RespEncoder.INSTANCE)
                                .addLast(new ReplicaHandshakeHandler(ReplicationHandshake.this));
                    }
                });

        // connect(host, port) 会先异步解析地址，解析失败同样走失败回调
        b.connect(leader.host(), leader.port())
                .addListener((ChannelFutureListener) future -> {
                    if (closingLocally) {
                        future.channel().close();
                        fail(ReplState.CONNECTING, "closed locally", future.cause());
                    } else if (future.isSuccess()) {
                        masterChannel = future.channel();
                        log.info("Connected to master {}. Starting handshake...", leader);
                        sendStep(ReplState.PINGED, command("PING"));
                    } else {
                        fail(ReplState.CONNECTING, "cannot connect to " + leader, future.cause());
                    }
                });
        return result;
    }

    /**
     * 收到 Master 的一帧回复，推进到下一步
     */
    void onReply(RedisMessage reply) {
        ReplState current = state;
        if (current.isTerminal()) {
            return;
        }

        if (reply instanceof ErrorMessage err) {
            fail(current, "master replied error: " + err.content(), null);
            return;
        }
        log.info("Received from master in {}: {}", current, describe(reply));

        switch (current) {
            case PINGED -> sendStep(ReplState.CONFIGURED_PORT,
                    command("REPLCONF", "listening-port", String.valueOf(listeningPort)));
            case CONFIGURED_PORT -> sendStep(ReplState.CONFIGURED_CAPA,
                    command("REPLCONF", "capa", "psync2"));
            case CONFIGURED_CAPA -> sendStep(ReplState.SYNC_REQUESTED,
                    command("PSYNC", "?", "-1"));
            case SYNC_REQUESTED -> complete(reply);
            default -> fail(current, "unexpected reply before any command was sent", null);
        }
    }

    void onError(Throwable cause) {
        ReplState current = state;
        if (current == ReplState.COMPLETE) {
            log.warn("Error on master connection after handshake", cause);
            closeChannel();
            return;
        }
        fail(current, String.valueOf(cause.getMessage()), cause);
    }

    void onDisconnected() {
        ReplState current = state;
        if (current == ReplState.COMPLETE) {
            log.info("Replication connection to {} closed{}", leader, closingLocally ? " locally" : " by master");
            return;
        }
        fail(current, closingLocally ? "closed locally" : "connection closed by master", null);
    }

    void onStreamBytes(int length) {
        metadata.addStreamBytes(length);
    }

    /**
     * 主动断开。握手未完成时 Future 以 "closed locally" 失败；还在建连时由建连回调收尾
     */
    public void close() {
        closingLocally = true;
        closeChannel();
    }

    // 单次写出一条完整命令，并为这一步重新计时
    private void sendStep(ReplState next, RedisArray cmd) {
        transition(next);
        armStepTimer(next);
        masterChannel.writeAndFlush(cmd).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                fail(next, "write failed", future.cause());
            }
        });
    }

    private void complete(RedisMessage psyncReply) {
        cancelStepTimer();
        metadata.applyPsyncReply(psyncReply);
        transition(ReplState.COMPLETE);
        log.info("Handshake complete. Master RunID: {}, offset: {}", metadata.getMasterRunId(), metadata.getMasterOffset());

        // 之后是 RDB 与命令流，不再按 RESP 回复解析；剩余字节以 ByteBuf 形式交给 handler
        if (masterChannel.pipeline().get(DECODER_NAME) != null) {
            masterChannel.pipeline().remove(DECODER_NAME);
        }
        result.complete(metadata);
    }

    private void fail(ReplState step, String reason, Throwable cause) {
        if (state != null && state.isTerminal()) {
            return;
        }
        cancelStepTimer();
        failedStep = step;
        transition(ReplState.FAILED);

        HandshakeException error = new HandshakeException(step, reason, cause);
        if (closingLocally) {
            log.info("Replication handshake with {} stopped: {}", leader, error.getMessage());
        } else {
            log.error("Replication handshake with {} failed: {}", leader, error.getMessage());
        }
        closeChannel();
        result.completeExceptionally(error);
    }

    private void armStepTimer(ReplState step) {
        cancelStepTimer();
        stepTimer = masterChannel.eventLoop().schedule(() -> {
            if (state == step) {
                fail(step, "no reply within " + stepTimeoutMillis + "ms", null);
            }
        }, stepTimeoutMillis, TimeUnit.MILLISECONDS);
    }

    private void cancelStepTimer() {
        if (stepTimer != null) {
            stepTimer.cancel(false);
            stepTimer = null;
        }
    }

    private void transition(ReplState next) {
        log.debug("Replication state: {} -> {}", state, next);
        state = next;
        transitions.add(next);
    }

    private void closeChannel() {
        Channel ch = masterChannel;
        if (ch != null && ch.isOpen()) {
            ch.close();
        }
    }

    private static String describe(RedisMessage reply) {
        if (reply instanceof SimpleString s) return "+" + s.content();
        if (reply instanceof BulkString b) return b.isNull() ? "(nil)" : b.asString();
        return reply.toString();
    }
}
