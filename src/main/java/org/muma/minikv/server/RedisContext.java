package org.muma.minikv.server;

import io.netty.channel.ChannelHandlerContext;
import lombok.Getter;
import org.muma.minikv.replication.ServerRole;

/**
 * 命令执行上下文
 * 封装了与当前命令相关的所有环境信息：来源连接、当前时间、服务角色
 */
@Getter
public class RedisContext {

    // 来自 Master 链路时为 null
    private final ChannelHandlerContext nettyCtx;
    private final long now;
    private final ServerRole role;
    // 是否为 Master 传播过来的命令 (Slave 侧)
    private final boolean fromMaster;

    private RedisContext(ChannelHandlerContext nettyCtx, long now, ServerRole role, boolean fromMaster) {
        this.nettyCtx = nettyCtx;
        this.now = now;
        this.role = role;
        this.fromMaster = fromMaster;
    }

    public static RedisContext client(ChannelHandlerContext nettyCtx, long now, ServerRole role) {
        return new RedisContext(nettyCtx, now, role, false);
    }

    public static RedisContext masterLink(long now, ServerRole role) {
        return new RedisContext(null, now, role, true);
    }
}
