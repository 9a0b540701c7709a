package org.muma.respkv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.ServerSocketChannel;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.respkv.command.CommandRouter;
import org.muma.respkv.config.ServerConfig;
import org.muma.respkv.protocol.RespEncoder;
import org.muma.respkv.server.AdmissionController;
import org.muma.respkv.server.ConnectionPermits;
import org.muma.respkv.server.RedisConnectionHandler;
import org.muma.respkv.store.ExpiryEvictor;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

public class RespKvServer {

    private static final Logger log = LoggerFactory.getLogger(RespKvServer.class);

    private final ServerConfig config;
    // 整个进程共享同一个存储句柄：所有连接和清理线程都引用它，不做拷贝
    private final StorageEngine storage;
    private final Clock clock;
    private final ConnectionPermits permits;
    private final ExpiryEvictor evictor;
    private final AtomicBoolean stopped = new AtomicBoolean();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RespKvServer(ServerConfig config) {
        this(config, new MemoryStorageEngine(), Clock.systemUTC());
    }

    public RespKvServer(ServerConfig config, StorageEngine storage, Clock clock) {
        this.config = config;
        this.storage = storage;
        this.clock = clock;
        this.permits = new ConnectionPermits(config.getMaxClients());
        this.evictor = new ExpiryEvictor(storage, clock, config.getEvictionIntervalMillis());
    }

    /**
     * 绑定端口并启动清理线程，绑定成功后立即返回
     *
     * @throws IllegalStateException 端口绑定失败
     */
    public void start() throws InterruptedException {
        // boss 只有一个线程，负责 accept 和准入控制；worker 线程池承载所有连接
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        CommandRouter router = new CommandRouter(storage, clock);
        RespEncoder encoder = new RespEncoder();
        AdmissionController admission = new AdmissionController(permits, config.getPermitTimeoutMillis());

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new ChannelInitializer<ServerSocketChannel>() {
                    @Override
                    protected void initChannel(ServerSocketChannel ch) {
                        // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                        ch.pipeline()
                                .addLast(new LoggingHandler(LogLevel.DEBUG))
                                .addLast(admission);
                    }
                })
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(encoder)
                                .addLast(new RedisConnectionHandler(router, config.isErrorReplies()));
                    }
                });

        log.info("Starting server on {}:{}", config.getBindAddress(), config.getPort());
        ChannelFuture future = bootstrap.bind(config.getBindAddress(), config.getPort()).await();
        if (!future.isSuccess()) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw new IllegalStateException("Failed to bind " + config.getBindAddress() + ":" + config.getPort(), future.cause());
        }
        serverChannel = future.channel();

        evictor.start();
        log.info("Listening on {}, max connections {}", serverChannel.localAddress(), config.getMaxClients());
    }

    /**
     * 实际监听的端口 (配置为 0 时由系统分配)
     */
    public int getPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping server...");
        permits.close();
        evictor.shutdown();
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        log.info("Server stopped.");
    }

    public static void main(String[] args) throws InterruptedException {
        ServerConfig config = ServerConfig.load(args);
        RespKvServer server = new RespKvServer(config);
        server.start();

        try {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown signal received. Shutting down...");
                server.stop();
                Runtime.getRuntime().halt(ExitCode.OK.getCode());
            }, "shutdown-hook"));
        } catch (IllegalStateException | SecurityException e) {
            log.error("Unable to listen for the shutdown signal", e);
            log.error("Terminating the app ({})...", ExitCode.SHUTDOWN.getCode());
            server.stop();
            System.exit(ExitCode.SHUTDOWN.getCode());
        }

        server.awaitTermination();
    }
}
