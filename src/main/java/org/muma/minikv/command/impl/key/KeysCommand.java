package org.muma.minikv.command.impl.key;

import org.muma.minikv.command.RedisCommand;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;
import org.muma.minikv.utils.GlobUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * KEYS pattern
 */
public class KeysCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        Pattern pattern = GlobUtil.compile(argString(args, 1));

        List<RedisMessage> result = new ArrayList<>();
        for (String key : storage.keys(context.getNow())) {
            if (GlobUtil.matches(pattern, key)) {
                result.add(new BulkString(key));
            }
        }
        return new RedisArray(result.toArray(new RedisMessage[0]));
    }

    @Override
    public int arity() {
        return 2;
    }
}
