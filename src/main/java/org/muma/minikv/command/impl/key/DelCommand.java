package org.muma.minikv.command.impl.key;

import org.muma.minikv.command.RedisCommand;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisInteger;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;

public class DelCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        // 格式: DEL key [key ...]
        int deletedCount = 0;
        long now = context.getNow();

        for (int i = 1; i < args.size(); i++) {
            String key = argString(args, i);
            // 已过期但尚未清理的 key 在逻辑上已不存在，不计数
            boolean live = storage.get(key, now) != null;
            storage.remove(key);
            if (live) {
                deletedCount++;
            }
        }

        return new RedisInteger(deletedCount);
    }

    @Override
    public int arity() {
        return -2;
    }

    @Override
    public boolean isWrite() {
        return true;
    }

    // 一个都没删掉就不传播
    @Override
    public boolean shouldPropagate(RedisMessage reply) {
        return reply instanceof RedisInteger count && count.value() > 0;
    }
}
