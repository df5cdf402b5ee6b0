package org.muma.minikv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import lombok.Getter;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.protocol.RespDecoder;
import org.muma.minikv.protocol.RespEncoder;
import org.muma.minikv.server.RedisCommandHandler;
import org.muma.minikv.server.RedisServerContext;
import org.muma.minikv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;

public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final MiniKvConfig config;
    @Getter
    private final RedisServerContext serverContext;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    // 实际绑定的端口 (配置为 0 时由系统分配)
    @Getter
    private int boundPort = -1;

    public MiniKvServer(MiniKvConfig config) {
        this.config = config;
        this.serverContext = new RedisServerContext(config);
    }

    /**
     * 加载数据 -> 绑定端口 -> 启动复制
     * 任何一步失败都会抛出异常，由调用方决定是否退出进程
     */
    public void start() throws InterruptedException {
        serverContext.init();

        bossGroup = new NioEventLoopGroup(1, ThreadUtils.namedThreadFactory("MiniKv-Boss"));
        workerGroup = new NioEventLoopGroup(0, ThreadUtils.namedThreadFactory("MiniKv-Worker"));

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                .handler(new LoggingHandler(LogLevel.DEBUG))
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                // 开启 SO_KEEPALIVE
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(new RedisCommandHandler(serverContext));
                    }
                });

        log.info("Starting mini-kv server on port {}", config.getPort());
        try {
            serverChannel = bootstrap.bind(config.getPort()).sync().channel();
        } catch (Exception e) {
            shutdown();
            throw e;
        }
        boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("mini-kv started successfully on port {} as {}", boundPort, serverContext.getRole().name());

        try {
            serverContext.startReplication(boundPort);
        } catch (RuntimeException e) {
            shutdown();
            throw e;
        }
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down mini-kv server");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        serverContext.shutdown();
    }

    public static void main(String[] args) {
        MiniKvServer server = null;
        try {
            // 1. 初始化配置并解析参数
            MiniKvConfig config = MiniKvConfig.load(args);
            server = new MiniKvServer(config);
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown));
            server.awaitTermination();
        } catch (Exception e) {
            log.error("Failed to start server", e);
            if (server != null) {
                server.shutdown();
            }
            System.exit(1);
        }
    }
}
