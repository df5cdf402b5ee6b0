package org.muma.minikv.command.impl.connection;

import org.muma.minikv.command.RedisCommand;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.protocol.SimpleString;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;

/**
 * PING [message]
 */
public class PingCommand implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return switch (args.size()) {
            case 1 -> PONG;
            case 2 -> args.elements()[1];
            default -> errorArgs("ping");
        };
    }

    @Override
    public int arity() {
        return -1;
    }
}
