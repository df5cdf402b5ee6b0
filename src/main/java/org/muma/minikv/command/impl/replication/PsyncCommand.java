package org.muma.minikv.command.impl.replication;

import org.muma.minikv.command.RedisCommand;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.replication.ReplicaHandle;
import org.muma.minikv.replication.ReplicationManager;
import org.muma.minikv.replication.SlaveState;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;

/**
 * PSYNC <replid> <offset>
 * <p>
 * 不支持部分重同步，任何 replid/offset 都走全量同步。
 * 回复 (+FULLRESYNC 和 RDB) 由 {@link ReplicationManager#fullResync} 直接写到连接上，这里返回 null。
 */
public class PsyncCommand implements RedisCommand {

    private final ReplicationManager replication;

    public PsyncCommand(ReplicationManager replication) {
        this.replication = replication;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (context.getRole().isReplica()) {
            return new ErrorMessage("ERR PSYNC not supported on a replica");
        }
        if (context.getNettyCtx() == null) {
            return new ErrorMessage("ERR PSYNC requires a client connection");
        }

        ReplicaHandle handle = replication.findHandle(context.getNettyCtx().channel());
        if (handle == null || handle.getState() != SlaveState.AWAITING_PSYNC) {
            return new ErrorMessage("ERR PSYNC received before REPLCONF handshake");
        }

        replication.fullResync(handle, context.getNow());
        return null;
    }

    @Override
    public int arity() {
        return 3;
    }
}
