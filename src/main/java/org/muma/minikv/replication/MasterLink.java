package org.muma.minikv.replication;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import lombok.Getter;
import org.muma.minikv.command.CommandDispatcher;
import org.muma.minikv.command.CommandResult;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RespDecoder;
import org.muma.minikv.protocol.RespEncoder;
import org.muma.minikv.rdb.RdbEntry;
import org.muma.minikv.rdb.RdbLoader;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.server.RedisCoreExecutor;
import org.muma.minikv.store.StorageEngine;
import org.muma.minikv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Slave 端到 Master 的复制链路
 * <p>
 * 握手在链路自己的 EventLoop 上推进 (见 {@link MasterLinkHandler})，
 * 快照加载和命令应用提交到核心线程，按到达顺序执行。
 * offset 只在一条命令完整应用之后才前进。
 */
public class MasterLink {

    private static final Logger log = LoggerFactory.getLogger(MasterLink.class);

    private final MiniKvConfig config;
    private final StorageEngine storage;
    private final CommandDispatcher dispatcher;
    private final RedisCoreExecutor coreExecutor;
    private final RdbLoader rdbLoader = new RdbLoader();
    private final ServerRole role = new ServerRole.Replica(this);

    private final NioEventLoopGroup group = new NioEventLoopGroup(1, ThreadUtils.namedThreadFactory("MiniKv-MasterLink"));
    private final Bootstrap bootstrap;

    @Getter
    private volatile ReplState state = ReplState.NONE;
    @Getter
    private volatile String masterReplId = "?";
    private final AtomicLong offset = new AtomicLong(0);

    private volatile Channel channel;
    private volatile int listeningPort;
    private volatile boolean stopped;

    public MasterLink(MiniKvConfig config, StorageEngine storage, CommandDispatcher dispatcher,
                      RedisCoreExecutor coreExecutor) {
        this.config = config;
        this.storage = storage;
        this.dispatcher = dispatcher;
        this.coreExecutor = coreExecutor;

        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder(true))
                                .addLast(new RespEncoder())
                                .addLast(new MasterLinkHandler(MasterLink.this, config.getReplAckPeriod()));
                    }
                });
    }

    public ServerRole role() {
        return role;
    }

    /**
     * 第一次连接同步进行，Master 不可达直接抛出 (启动失败)；之后的断线由链路自己重连
     *
     * @param listeningPort 本机实际监听的端口，握手时上报给 Master
     */
    public void start(int listeningPort) {
        setListeningPort(listeningPort);
        log.info("Connecting to master {}:{}", config.getReplicaOfHost(), config.getReplicaOfPort());
        ChannelFuture future = connect().awaitUninterruptibly();
        if (!future.isSuccess()) {
            state = ReplState.DISCONNECTED;
            throw new ReplicationHandshakeException("Cannot reach master "
                    + config.getReplicaOfHost() + ":" + config.getReplicaOfPort(), future.cause());
        }
    }

    void setListeningPort(int listeningPort) {
        this.listeningPort = listeningPort;
    }

    private ChannelFuture connect() {
        state = ReplState.CONNECTING;
        return bootstrap.connect(config.getReplicaOfHost(), config.getReplicaOfPort());
    }

    private void reconnect() {
        if (stopped) return;
        connect().addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to connect to master: {}", future.cause().getMessage());
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect() {
        if (stopped || group.isShuttingDown()) return;
        state = ReplState.DISCONNECTED;
        long backoff = config.getReplReconnectBackoffMs();
        log.info("Reconnecting to master in {}ms", backoff);
        group.schedule(this::reconnect, backoff, TimeUnit.MILLISECONDS);
    }

    // =========================================================
    // 链路回调 (MasterLinkHandler)
    // =========================================================

    void onConnected(Channel ch) {
        this.channel = ch;
        log.info("Connected to master {}, starting handshake", ch.remoteAddress());
        sendPing();
    }

    void onDisconnected() {
        this.channel = null;
        if (stopped) {
            state = ReplState.DISCONNECTED;
            return;
        }
        log.warn("Lost connection to master (state was {})", state);
        scheduleReconnect();
    }

    // --- State Actions ---
    void sendPing() {
        state = ReplState.SENT_PING;
        writeToMaster(RedisArray.of("PING"));
    }

    void sendReplConfPort() {
        state = ReplState.SENT_REPLCONF_PORT;
        writeToMaster(RedisArray.of("REPLCONF", "listening-port", String.valueOf(listeningPort)));
    }

    void sendReplConfCapa() {
        state = ReplState.SENT_REPLCONF_CAPA;
        writeToMaster(RedisArray.of("REPLCONF", "capa", "eof", "capa", "psync2"));
    }

    void sendPsync() {
        state = ReplState.SENT_PSYNC;
        writeToMaster(RedisArray.of("PSYNC", "?", "-1"));
    }

    void beginFullResync(String replId, long baseline) {
        log.info("Full resync triggered. Master replid: {}, offset: {}", replId, baseline);
        this.masterReplId = replId;
        // 在核心线程上重置，排在上一条链路遗留的 applyPropagated 之后
        coreExecutor.submit(() -> offset.set(baseline));
        state = ReplState.LOADING_SNAPSHOT;
    }

    /**
     * 用 Master 的快照替换本地数据
     */
    void loadSnapshot(byte[] rdb) {
        state = ReplState.STREAMING;
        Channel link = this.channel;
        coreExecutor.submit(() -> {
            long start = System.currentTimeMillis();
            storage.flush();
            try {
                List<RdbEntry> entries = rdbLoader.read(rdb);
                int loaded = RdbLoader.apply(entries, storage, System.currentTimeMillis());
                log.info("Loaded {} keys from master snapshot ({} bytes) in {}ms",
                        loaded, rdb.length, System.currentTimeMillis() - start);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to load snapshot from master, dropping link", e);
                storage.flush();
                if (link != null) {
                    link.close();
                }
            }
        });
    }

    /**
     * 应用 Master 传播过来的一条命令
     *
     * @param length 该命令在链路上占用的字节数
     */
    void applyPropagated(RedisArray command, int length) {
        String name = ((BulkString) command.elements()[0]).asString().toUpperCase(Locale.ROOT);
        coreExecutor.submit(() -> {
            if ("PING".equals(name)) {
                offset.addAndGet(length);
                sendAck();
            } else if ("REPLCONF".equals(name) && command.size() >= 2
                    && "GETACK".equalsIgnoreCase(((BulkString) command.elements()[1]).asString())) {
                // 上报的 offset 不包含 GETACK 自身
                sendAck();
                offset.addAndGet(length);
            } else {
                CommandResult result = dispatcher.dispatch(name, command,
                        RedisContext.masterLink(System.currentTimeMillis(), role));
                if (result.reply() instanceof ErrorMessage err) {
                    log.warn("Propagated command {} failed on replica: {}", name, err.content());
                }
                offset.addAndGet(length);
            }
        });
    }

    void sendAck() {
        if (state != ReplState.STREAMING) return;
        long current = offset.get();
        log.debug("Sending REPLCONF ACK {}", current);
        writeToMaster(RedisArray.of("REPLCONF", "ACK", String.valueOf(current)));
    }

    private void writeToMaster(RedisArray command) {
        Channel ch = this.channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(command);
        }
    }

    public long getOffset() {
        return offset.get();
    }

    public boolean isLinkUp() {
        return state == ReplState.STREAMING;
    }

    public void shutdown() {
        stopped = true;
        Channel ch = this.channel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
