package org.muma.minikv.replication;

import io.netty.channel.Channel;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.Getter;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.protocol.RdbPayload;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.SimpleString;
import org.muma.minikv.rdb.RdbSaver;
import org.muma.minikv.server.RedisCoreExecutor;
import org.muma.minikv.store.StorageEngine;
import org.muma.minikv.utils.RespCodecUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * 复制管理器 (Master 角色)
 * <p>
 * 维护 Slave 连接、全量同步和命令传播。除 {@link #getReplicas()} 外所有方法都必须在核心线程调用，
 * 这样写命令的执行和传播入队是同一个原子步骤，每个 Slave 收到的顺序就是提交顺序。
 */
public class ReplicationManager {

    private static final Logger log = LoggerFactory.getLogger(ReplicationManager.class);

    private static final byte[] PING = RespCodecUtil.encodeCommand(RedisArray.of("PING").elements());

    private final MiniKvConfig config;
    private final StorageEngine storage;
    private final RedisCoreExecutor coreExecutor;
    private final RdbSaver rdbSaver;

    @Getter
    private final ReplicationMetadata metadata;

    // 发送过 REPLCONF 的连接 (包含握手中的和已在线的)
    private final Map<Channel, ReplicaHandle> handles = new HashMap<>();

    // 在线 Slave 列表 (已完成全量同步，直接转发命令)
    private final List<ReplicaHandle> onlineReplicas = new CopyOnWriteArrayList<>();

    private ScheduledFuture<?> pingTask;

    public ReplicationManager(MiniKvConfig config, StorageEngine storage, RedisCoreExecutor coreExecutor,
                              ReplicationMetadata metadata, RdbSaver rdbSaver) {
        this.config = config;
        this.storage = storage;
        this.coreExecutor = coreExecutor;
        this.metadata = metadata;
        this.rdbSaver = rdbSaver;
    }

    // =========================================================
    // 握手
    // =========================================================

    public ReplicaHandle handshakeHandle(Channel channel) {
        return handles.computeIfAbsent(channel, ReplicaHandle::new);
    }

    public ReplicaHandle findHandle(Channel channel) {
        return handles.get(channel);
    }

    /**
     * 全量同步：回复 +FULLRESYNC，紧接着发送当前数据的 RDB 快照，然后注册为在线 Slave
     * 此后提交的写命令都排在快照之后
     */
    public void fullResync(ReplicaHandle handle, long now) {
        Channel channel = handle.getChannel();
        long offset = metadata.getReplOffset();
        byte[] snapshot = rdbSaver.serialize(storage, now);

        channel.write(new SimpleString("FULLRESYNC " + metadata.getReplId() + " " + offset));
        channel.writeAndFlush(new RdbPayload(snapshot));

        handle.markStreaming();
        onlineReplicas.add(handle);
        log.info("Full resync with replica {} started: offset={}, snapshot={} bytes",
                handle.describe(), offset, snapshot.length);
    }

    // =========================================================
    // 命令传播
    // =========================================================

    /**
     * @param command 规范化编码后的命令 (array of bulk strings)
     */
    public void propagate(byte[] command) {
        metadata.addOffset(command.length);
        for (ReplicaHandle replica : onlineReplicas) {
            replica.send(command);
        }
    }

    public void deregister(Channel channel) {
        ReplicaHandle handle = handles.remove(channel);
        if (handle != null && onlineReplicas.remove(handle)) {
            log.info("Replica {} disconnected, ack offset was {}", handle.describe(), handle.getAckOffset());
        }
    }

    /**
     * 有 Slave 在线时，定期传播 PING 作为心跳
     */
    public void startPing() {
        long period = config.getReplPingReplicaPeriod();
        pingTask = coreExecutor.scheduleAtFixedRate(() -> {
            if (!onlineReplicas.isEmpty()) {
                propagate(PING);
            }
        }, period, period, TimeUnit.SECONDS);
    }

    public List<ReplicaHandle> getReplicas() {
        return List.copyOf(onlineReplicas);
    }

    public void shutdown() {
        if (pingTask != null) {
            pingTask.cancel(false);
        }
        for (ReplicaHandle replica : onlineReplicas) {
            replica.getChannel().close();
        }
    }
}
