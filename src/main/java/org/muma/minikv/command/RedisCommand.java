package org.muma.minikv.command;

import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;

public interface RedisCommand {

    // 执行命令，传入存储引擎和参数 (args[0] 是命令名)
    // 返回 null 表示不回复 (如 REPLCONF ACK，或命令自己已经写回了连接)
    RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context);

    /**
     * 参数个数 (含命令名)，与 Redis 的约定一致:
     * 正数 N 表示必须正好 N 个，负数 -N 表示至少 N 个
     */
    int arity();

    // 默认不是写命令，SET/DEL 需要覆盖返回 true
    default boolean isWrite() {
        return false;
    }

    /**
     * 写命令执行后是否需要传播给 Slave
     * 默认：写命令且执行成功就传播；真正没有改动数据的情况由具体命令覆盖
     */
    default boolean shouldPropagate(RedisMessage reply) {
        return isWrite() && reply != null && !(reply instanceof ErrorMessage);
    }

    default boolean checkArity(int argc) {
        int arity = arity();
        return arity > 0 ? argc == arity : argc >= -arity;
    }

    /**
     * 辅助工具：快速构建参数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return ErrorMessage.sanitized("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 辅助工具：快速构建数值错误
     */
    default ErrorMessage errorInt() {
        return new ErrorMessage("ERR value is not an integer or out of range");
    }

    default ErrorMessage errorSyntax() {
        return new ErrorMessage("ERR syntax error");
    }

    // 参数取值，Handler 已经保证了所有参数都是非 null 的 BulkString
    default String argString(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).asString();
    }

    default byte[] argBytes(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).content();
    }
}
