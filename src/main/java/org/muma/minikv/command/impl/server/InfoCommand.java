package org.muma.minikv.command.impl.server;

import org.muma.minikv.command.RedisCommand;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.replication.MasterLink;
import org.muma.minikv.replication.ReplicaHandle;
import org.muma.minikv.replication.ReplicationManager;
import org.muma.minikv.replication.ServerRole;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;

import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * INFO [section]
 * 支持 server / replication / keyspace 三个 section，不带参数时全部返回
 */
public class InfoCommand implements RedisCommand {

    private final MiniKvConfig config;
    private final ReplicationManager replication;

    public InfoCommand(MiniKvConfig config, ReplicationManager replication) {
        this.config = config;
        this.replication = replication;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String section = args.size() > 1 ? argString(args, 1).toLowerCase(Locale.ROOT) : "all";

        List<String> sections = new ArrayList<>();
        boolean all = "all".equals(section) || "default".equals(section) || "everything".equals(section);
        if (all || "server".equals(section)) {
            sections.add(server());
        }
        if (all || "replication".equals(section)) {
            sections.add(replication(context.getRole()));
        }
        if (all || "keyspace".equals(section)) {
            sections.add(keyspace(storage, context.getNow()));
        }
        return new BulkString(String.join("\r\n", sections));
    }

    private String server() {
        long uptime = ManagementFactory.getRuntimeMXBean().getUptime() / 1000;
        return "# Server\r\n"
                + "redis_version:7.0.0\r\n"
                + "redis_mode:standalone\r\n"
                + "os:" + System.getProperty("os.name") + "\r\n"
                + "multiplexing_api:netty\r\n"
                + "process_id:" + ProcessHandle.current().pid() + "\r\n"
                + "tcp_port:" + config.getPort() + "\r\n"
                + "uptime_in_seconds:" + uptime + "\r\n"
                + "executable:mini-kv\r\n";
    }

    private String replication(ServerRole role) {
        StringBuilder sb = new StringBuilder("# Replication\r\n");
        if (role instanceof ServerRole.Replica replica) {
            MasterLink link = replica.masterLink();
            sb.append("role:slave\r\n");
            sb.append("master_host:").append(config.getReplicaOfHost()).append("\r\n");
            sb.append("master_port:").append(config.getReplicaOfPort()).append("\r\n");
            sb.append("master_link_status:").append(link.isLinkUp() ? "up" : "down").append("\r\n");
            sb.append("slave_repl_offset:").append(link.getOffset()).append("\r\n");
            sb.append("master_replid:").append(link.getMasterReplId()).append("\r\n");
        } else {
            List<ReplicaHandle> replicas = replication.getReplicas();
            sb.append("role:master\r\n");
            sb.append("connected_slaves:").append(replicas.size()).append("\r\n");
            for (int i = 0; i < replicas.size(); i++) {
                ReplicaHandle h = replicas.get(i);
                sb.append("slave").append(i).append(":ip=").append(h.ip())
                        .append(",port=").append(h.getListeningPort())
                        .append(",state=online")
                        .append(",offset=").append(h.getAckOffset()).append("\r\n");
            }
            sb.append("master_replid:").append(replication.getMetadata().getReplId()).append("\r\n");
            sb.append("master_repl_offset:").append(replication.getMetadata().getReplOffset()).append("\r\n");
        }
        return sb.toString();
    }

    private String keyspace(StorageEngine storage, long now) {
        StringBuilder sb = new StringBuilder("# Keyspace\r\n");
        int keys = storage.keys(now).size();
        if (keys > 0) {
            sb.append("db0:keys=").append(keys).append(",expires=0,avg_ttl=0\r\n");
        }
        return sb.toString();
    }

    @Override
    public int arity() {
        return -1;
    }
}
