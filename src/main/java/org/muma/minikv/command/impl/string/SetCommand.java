package org.muma.minikv.command.impl.string;

import org.muma.minikv.command.RedisCommand;
import org.muma.minikv.common.RedisData;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.protocol.SimpleString;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;

import java.util.Locale;

public class SetCommand implements RedisCommand {

    private static final SimpleString OK = new SimpleString("OK");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        // 基本格式: SET key value [NX|XX] [EX seconds | PX milliseconds]
        String key = argString(args, 1);
        byte[] value = argBytes(args, 2);
        long now = context.getNow();

        // --- 1. 参数解析阶段 ---
        boolean nx = false; // Not Exist
        boolean xx = false; // Already Exist
        long expireAt = RedisData.NO_EXPIRE;

        // 从第3个参数开始解析选项
        int argc = args.size();
        for (int i = 3; i < argc; i++) {
            String opt = argString(args, i).toUpperCase(Locale.ROOT);
            switch (opt) {
                case "NX" -> {
                    if (xx) return errorSyntax();
                    nx = true;
                }
                case "XX" -> {
                    if (nx) return errorSyntax();
                    xx = true;
                }
                case "EX", "PX" -> {
                    if (expireAt != RedisData.NO_EXPIRE || i + 1 >= argc) return errorSyntax();
                    long amount;
                    try {
                        amount = Long.parseLong(argString(args, ++i));
                    } catch (NumberFormatException e) {
                        return errorInt();
                    }
                    // 0 是允许的：写入即过期
                    if (amount < 0) {
                        return errorExpire();
                    }
                    // 溢出时不写入，也不会传播
                    try {
                        long millis = "EX".equals(opt) ? Math.multiplyExact(amount, 1000L) : amount;
                        expireAt = Math.addExact(now, millis);
                    } catch (ArithmeticException e) {
                        return errorExpire();
                    }
                }
                default -> {
                    return errorSyntax();
                }
            }
        }

        // --- 2. 逻辑检查阶段 (NX/XX) ---
        // 命令在核心线程串行执行，检查与写入之间不会被其他命令插入
        RedisData existing = storage.get(key, now);
        if (nx && existing != null) {
            return BulkString.NULL; // Key 存在，NX 条件不满足，返回 Nil
        }
        if (xx && existing == null) {
            return BulkString.NULL; // Key 不存在，XX 条件不满足，返回 Nil
        }

        // --- 3. 写入阶段 ---
        storage.set(key, value, expireAt);
        return OK;
    }

    private static ErrorMessage errorExpire() {
        return new ErrorMessage("ERR invalid expire time in 'set' command");
    }

    @Override
    public int arity() {
        return -3;
    }

    @Override
    public boolean isWrite() {
        return true;
    }

    // NX/XX 未生效时返回 Nil，此时没有写入，不传播
    @Override
    public boolean shouldPropagate(RedisMessage reply) {
        return reply instanceof SimpleString;
    }
}
