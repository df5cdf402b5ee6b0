package org.muma.minikv.command;

import org.muma.minikv.protocol.RedisMessage;

/**
 * 命令执行结果
 *
 * @param reply       回复给客户端的消息，null 表示不回复
 * @param propagation 需要传播给 Slave 的规范化命令字节，null 表示不传播
 */
public record CommandResult(RedisMessage reply, byte[] propagation) {

    public static CommandResult reply(RedisMessage reply) {
        return new CommandResult(reply, null);
    }

    public boolean shouldPropagate() {
        return propagation != null;
    }
}
