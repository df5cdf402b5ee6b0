package org.muma.minikv.command.impl.server;

import org.muma.minikv.command.RedisCommand;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;

import java.util.Locale;
import java.util.Optional;

/**
 * CONFIG GET parameter
 * <p>
 * 返回 [parameter, value]，未知参数返回空数组。
 */
public class ConfigCommand implements RedisCommand {

    private final MiniKvConfig config;

    public ConfigCommand(MiniKvConfig config) {
        this.config = config;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String sub = argString(args, 1);
        if (!"GET".equals(sub.toUpperCase(Locale.ROOT))) {
            return ErrorMessage.sanitized("ERR unknown subcommand '" + sub + "'");
        }
        if (args.size() != 3) {
            return errorArgs("config|get");
        }

        String param = argString(args, 2);
        Optional<String> value = config.lookup(param);
        if (value.isEmpty()) {
            return RedisArray.EMPTY;
        }
        return new RedisArray(new RedisMessage[]{
                new BulkString(param),
                new BulkString(value.get())
        });
    }

    @Override
    public int arity() {
        return -2;
    }
}
