package org.muma.minikv.command.impl.connection;

import org.muma.minikv.command.RedisCommand;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;

public class EchoCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return args.elements()[1];
    }

    @Override
    public int arity() {
        return 2;
    }
}
