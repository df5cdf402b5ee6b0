package org.muma.minikv.replication;

/**
 * 服务角色，启动时由配置决定，运行期间不变
 * <p>
 * 单机模式就是没有任何 Slave 注册的 Master。
 */
public sealed interface ServerRole permits ServerRole.Master, ServerRole.Replica {

    default boolean isReplica() {
        return false;
    }

    String name();

    record Master(ReplicationManager replication) implements ServerRole {
        @Override
        public String name() {
            return "master";
        }
    }

    record Replica(MasterLink masterLink) implements ServerRole {
        @Override
        public boolean isReplica() {
            return true;
        }

        @Override
        public String name() {
            return "slave";
        }
    }
}
