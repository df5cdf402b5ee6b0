package org.muma.minikv.server;

import lombok.Getter;
import org.muma.minikv.command.CommandDispatcher;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.rdb.RdbEntry;
import org.muma.minikv.rdb.RdbLoader;
import org.muma.minikv.rdb.RdbSaver;
import org.muma.minikv.replication.MasterLink;
import org.muma.minikv.replication.ReplicationManager;
import org.muma.minikv.replication.ReplicationMetadata;
import org.muma.minikv.replication.ServerRole;
import org.muma.minikv.store.StorageEngine;
import org.muma.minikv.store.StoreUnavailableException;
import org.muma.minikv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 服务器上下文
 * 负责组装各个模块，管理生命周期。每个 Server 实例一份，互不共享。
 */
@Getter
public class RedisServerContext {

    private static final Logger log = LoggerFactory.getLogger(RedisServerContext.class);

    // 定期删除的执行间隔
    private static final long ACTIVE_EXPIRE_INTERVAL_MS = 100;

    private final MiniKvConfig config;
    private final StorageEngine storage;
    private final RedisCoreExecutor coreExecutor;
    private final ReplicationManager replicationManager;
    private final CommandDispatcher dispatcher;
    // 仅 Slave 模式存在
    private final MasterLink masterLink;
    private final ServerRole role;

    public RedisServerContext(MiniKvConfig config) {
        this.config = config;

        // 1. Storage
        this.storage = new MemoryStorageEngine();

        // 2. Core Executor
        this.coreExecutor = new RedisCoreExecutor();

        // 3. Replication (Master 侧)
        this.replicationManager = new ReplicationManager(config, storage, coreExecutor,
                new ReplicationMetadata(), new RdbSaver());

        // 4. Dispatcher
        this.dispatcher = new CommandDispatcher(storage, config, replicationManager);

        // 5. Role：启动时确定，运行期不变
        if (config.isReplica()) {
            this.masterLink = new MasterLink(config, storage, dispatcher, coreExecutor);
            this.role = masterLink.role();
        } else {
            this.masterLink = null;
            this.role = new ServerRole.Master(replicationManager);
        }
    }

    /**
     * 核心初始化流程
     * 顺序：数据恢复 -> 启动后台任务
     */
    public void init() {
        // Step 1: 数据恢复
        loadSnapshot(config.getSnapshotFile());

        // Step 2: 定期删除过期 key
        coreExecutor.scheduleAtFixedRate(() -> {
            int expired = storage.activeExpireCycle(System.currentTimeMillis());
            if (expired > 0) {
                log.debug("Active expire cycle removed {} keys", expired);
            }
        }, ACTIVE_EXPIRE_INTERVAL_MS, ACTIVE_EXPIRE_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    private void loadSnapshot(File file) {
        List<RdbEntry> entries;
        try {
            entries = new RdbLoader().load(file);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to load snapshot " + file.getPath(), e);
        }
        if (entries.isEmpty()) {
            return;
        }

        long start = System.currentTimeMillis();
        Integer loaded = coreExecutor.submit(() -> RdbLoader.apply(entries, storage, System.currentTimeMillis()))
                .syncUninterruptibly()
                .getNow();
        log.info("Loaded {} keys from {} in {}ms ({} expired entries dropped)",
                loaded, file.getPath(), System.currentTimeMillis() - start, entries.size() - loaded);
    }

    /**
     * 端口绑定之后再启动复制：Slave 需要上报实际监听的端口
     */
    public void startReplication(int boundPort) {
        if (masterLink != null) {
            masterLink.start(boundPort);
        } else {
            replicationManager.startPing();
        }
    }

    public void shutdown() {
        if (masterLink != null) {
            masterLink.shutdown();
        }
        coreExecutor.submit(replicationManager::shutdown).syncUninterruptibly();
        coreExecutor.shutdown();
    }
}
