package org.muma.minikv.command.impl.replication;

import io.netty.channel.Channel;
import org.muma.minikv.command.RedisCommand;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.protocol.SimpleString;
import org.muma.minikv.replication.ReplicaHandle;
import org.muma.minikv.replication.ReplicationManager;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * REPLCONF <option> <value> [<option> <value> ...]
 * <p>
 * listening-port / capa 用于握手；ACK 是 Slave 上报 offset，不回复。
 */
public class ReplConfCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(ReplConfCommand.class);

    private static final SimpleString OK = new SimpleString("OK");

    private final ReplicationManager replication;

    public ReplConfCommand(ReplicationManager replication) {
        this.replication = replication;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (context.getNettyCtx() == null) {
            return new ErrorMessage("ERR REPLCONF requires a client connection");
        }
        Channel channel = context.getNettyCtx().channel();

        String option = argString(args, 1).toLowerCase(Locale.ROOT);
        if ("ack".equals(option)) {
            ReplicaHandle handle = replication.findHandle(channel);
            if (handle == null) {
                log.warn("REPLCONF ACK from unknown connection {}", channel.remoteAddress());
                return null;
            }
            try {
                handle.setAckOffset(Long.parseLong(argString(args, 2)));
            } catch (NumberFormatException e) {
                log.warn("Invalid REPLCONF ACK offset from {}: {}", handle.describe(), argString(args, 2));
            }
            return null;
        }

        if ((args.size() - 1) % 2 != 0) {
            return errorSyntax();
        }

        ReplicaHandle handle = replication.handshakeHandle(channel);
        for (int i = 1; i < args.size(); i += 2) {
            String opt = argString(args, i).toLowerCase(Locale.ROOT);
            String value = argString(args, i + 1);
            switch (opt) {
                case "listening-port" -> {
                    int port;
                    try {
                        port = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        return errorInt();
                    }
                    if (port <= 0 || port > 65535) {
                        return errorInt();
                    }
                    handle.onListeningPort(port);
                }
                case "capa" -> handle.onCapa();
                default -> {
                    return ErrorMessage.sanitized("ERR Unrecognized REPLCONF option: " + argString(args, i));
                }
            }
        }
        return OK;
    }

    @Override
    public int arity() {
        return -3;
    }
}
