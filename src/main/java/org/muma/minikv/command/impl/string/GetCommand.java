package org.muma.minikv.command.impl.string;

import org.muma.minikv.command.RedisCommand;
import org.muma.minikv.common.RedisData;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisData data = storage.get(argString(args, 1), context.getNow());
        if (data == null) {
            return BulkString.NULL; // Nil
        }
        return new BulkString(data.getValue());
    }

    @Override
    public int arity() {
        return 2;
    }
}
