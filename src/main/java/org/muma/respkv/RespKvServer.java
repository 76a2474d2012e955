package org.muma.respkv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.config.ServerConfig;
import org.muma.respkv.protocol.RespDecoder;
import org.muma.respkv.protocol.RespEncoder;
import org.muma.respkv.replication.ReplicationHandshake;
import org.muma.respkv.server.RedisCommandHandler;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public class RespKvServer {

    private static final Logger log = LoggerFactory.getLogger(RespKvServer.class);

    private final ServerConfig config;
    private final StorageEngine storage;
    private final CommandDispatcher dispatcher;
    private final AtomicLong acceptedConnections = new AtomicLong();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private ReplicationHandshake handshake;

    public RespKvServer(ServerConfig config) {
        this(config, new MemoryStorageEngine());
    }

    public RespKvServer(ServerConfig config, StorageEngine storage) {
        this.config = config;
        this.storage = storage;
        this.dispatcher = new CommandDispatcher(storage);
    }

    /**
     * 绑定端口并开始接收连接，端口为 0 时由系统分配，见 {@link #boundPort()}
     */
    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("respkv-boss"));
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads(), new DefaultThreadFactory("respkv-worker"));

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, config.getTcpBacklog())
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        // Boss 线程上的日志可以看到监听端口的绑定和 accept 细节
                        ch.pipeline()
                                .addLast(new LoggingHandler(LogLevel.DEBUG))
                                .addLast(new AcceptErrorHandler());
                    }
                })
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        acceptedConnections.incrementAndGet();
                        ChannelPipeline pipeline = ch.pipeline();
                        if (config.getTimeout() > 0) {
                            pipeline.addLast(new IdleStateHandler(config.getTimeout(), 0, 0, TimeUnit.SECONDS));
                        }
                        pipeline.addLast(new RespDecoder(RespDecoder.Mode.COMMAND, config.getProtoMaxBulkLen()))
                                .addLast(RespEncoder.INSTANCE)
                                .addLast(new RedisCommandHandler(dispatcher));
                    }
                });

        log.info("Starting resp-kv server on port {}", config.getPort());
        try {
            serverChannel = bootstrap.bind(config.getPort()).sync().channel();
        } catch (Exception e) {
            shutdownGroups();
            throw e;
        }
        log.info("resp-kv started successfully on port {}.", boundPort());
    }

    /**
     * 以从节点身份向配置的 Master 发起握手
     */
    public ReplicationHandshake startReplication() {
        if (!config.isReplica()) {
            throw new IllegalStateException("replicaof is not configured");
        }
        if (workerGroup == null) {
            throw new IllegalStateException("server is not started");
        }

        handshake = new ReplicationHandshake(config.getReplicaOf(), boundPort(),
                TimeUnit.SECONDS.toMillis(config.getReplTimeout()), workerGroup);
        handshake.start().whenComplete((meta, error) -> {
            if (error == null) {
                log.info("Replica ready, master {} runid {}", meta.getLeader(), meta.getMasterRunId());
            }
        });
        return handshake;
    }

    public int boundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    Channel serverChannel() {
        return serverChannel;
    }

    public long acceptedConnections() {
        return acceptedConnections.get();
    }

    public StorageEngine storage() {
        return storage;
    }

    public void awaitClose() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    public void stop() {
        log.info("Shutting down resp-kv server...");
        if (handshake != null) {
            handshake.close();
        }
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        shutdownGroups();
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
    }

    /**
     * accept 失败记录日志，监听端口保持打开。
     * 异常继续往后传给 ServerBootstrapAcceptor，由它暂停 accept 1 秒 (比如 fd 用尽时避免空转)
     */
    private static class AcceptErrorHandler extends ChannelInboundHandlerAdapter {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Failed to accept a connection on {}: {}", ctx.channel().localAddress(), cause.toString());
            ctx.fireExceptionCaught(cause);
        }
    }

    public static void main(String[] args) throws InterruptedException {
        ServerConfig config = ServerConfig.load(args);
        RespKvServer server = new RespKvServer(config);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "respkv-shutdown"));

        if (config.isReplica()) {
            server.startReplication();
        }
        server.awaitClose();
    }
}
