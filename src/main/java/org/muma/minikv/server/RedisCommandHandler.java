package org.muma.minikv.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.minikv.command.CommandDispatcher;
import org.muma.minikv.command.CommandResult;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.protocol.RedisProtocolException;
import org.muma.minikv.replication.ReplicationManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 客户端连接 Handler
 * 解码后的命令全部提交到 CoreExecutor 单线程执行；协议错误只关闭当前连接。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;
    private final RedisCoreExecutor coreExecutor;
    private final ReplicationManager replicationManager;
    private final RedisServerContext serverContext;

    public RedisCommandHandler(RedisServerContext serverContext) {
        this.serverContext = serverContext;
        this.dispatcher = serverContext.getDispatcher();
        this.coreExecutor = serverContext.getCoreExecutor();
        this.replicationManager = serverContext.getReplicationManager();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.decrementAndGet());
        // 如果是 Slave 连接，从复制列表中注销
        coreExecutor.submit(() -> replicationManager.deregister(ctx.channel()));
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (msg instanceof RedisArray array) {
            handleCommand(ctx, array);
        } else {
            log.warn("Received non-array message: {}", msg);
            ctx.writeAndFlush(new ErrorMessage("ERR Protocol error: expected array"));
        }
    }

    private void handleCommand(ChannelHandlerContext ctx, RedisArray array) {
        RedisMessage[] elements = array.elements();
        if (elements == null || elements.length == 0) return;

        for (RedisMessage element : elements) {
            if (!(element instanceof BulkString bulk) || bulk.isNull()) {
                ctx.writeAndFlush(new ErrorMessage("ERR Protocol error: command arguments must be bulk strings"));
                return;
            }
        }

        String commandName = ((BulkString) elements[0]).asString();

        if (log.isDebugEnabled()) {
            String argsLog = Arrays.stream(elements).skip(1)
                    .map(e -> ((BulkString) e).asString())
                    .collect(Collectors.joining(", "));
            log.debug("Execute Command: {} args=[{}]", commandName, argsLog);
        }

        // 所有逻辑提交到 CoreExecutor 单线程执行：执行与传播是一个原子步骤
        coreExecutor.submit(() -> {
            RedisContext context = RedisContext.client(ctx, System.currentTimeMillis(), serverContext.getRole());
            CommandResult result = dispatcher.dispatch(commandName, array, context);
            if (result.shouldPropagate()) {
                replicationManager.propagate(result.propagation());
            }
            if (result.reply() != null) {
                ctx.writeAndFlush(result.reply());
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof RedisProtocolException) {
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.writeAndFlush(ErrorMessage.sanitized("ERR Protocol error: " + cause.getMessage()))
                    .addListener(f -> ctx.close());
        } else if (cause instanceof IOException) {
            log.debug("Connection {} closed: {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.close();
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
