package org.muma.minikv.replication;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.util.concurrent.ScheduledFuture;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RdbPayload;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.protocol.RespFrame;
import org.muma.minikv.protocol.SimpleString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Slave 端的 Netty Handler
 * 负责处理 Master 发回的握手响应、RDB 数据流、Command 传播流。
 * 任何意料之外的帧都会断开链路，由 {@link MasterLink} 负责重连。
 */
public class MasterLinkHandler extends SimpleChannelInboundHandler<RespFrame> {

    private static final Logger log = LoggerFactory.getLogger(MasterLinkHandler.class);

    private final MasterLink link;
    private final long ackPeriodSeconds;
    private ScheduledFuture<?> ackTask;

    public MasterLinkHandler(MasterLink link, long ackPeriodSeconds) {
        this.link = link;
        this.ackPeriodSeconds = ackPeriodSeconds;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        link.onConnected(ctx.channel());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (ackTask != null) {
            ackTask.cancel(false);
        }
        link.onDisconnected();
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RespFrame frame) {
        RedisMessage msg = frame.message();

        if (msg instanceof ErrorMessage err) {
            throw new ReplicationHandshakeException("Master responded error: " + err.content());
        }

        ReplState state = link.getState();
        switch (state) {
            case SENT_PING -> {
                expectSimple(msg, "PONG", state);
                log.info("Master PONG received.");
                link.sendReplConfPort();
            }
            case SENT_REPLCONF_PORT -> {
                expectSimple(msg, "OK", state);
                link.sendReplConfCapa();
            }
            case SENT_REPLCONF_CAPA -> {
                expectSimple(msg, "OK", state);
                link.sendPsync();
            }
            case SENT_PSYNC -> {
                // +FULLRESYNC <replid> <offset>
                String[] parts = msg instanceof SimpleString ss ? ss.content().split(" ") : new String[0];
                if (parts.length != 3 || !"FULLRESYNC".equals(parts[0])) {
                    throw unexpected(msg, state);
                }
                long baseline;
                try {
                    baseline = Long.parseLong(parts[2]);
                } catch (NumberFormatException e) {
                    throw new ReplicationHandshakeException("Invalid FULLRESYNC offset: " + parts[2], e);
                }
                link.beginFullResync(parts[1], baseline);
            }
            case LOADING_SNAPSHOT -> {
                if (!(msg instanceof RdbPayload rdb)) {
                    throw unexpected(msg, state);
                }
                log.info("Received snapshot from master: {} bytes", rdb.length());
                link.loadSnapshot(rdb.content());
                startAckTimer(ctx);
            }
            case STREAMING -> {
                if (!isCommand(msg)) {
                    throw unexpected(msg, state);
                }
                link.applyPropagated((RedisArray) msg, frame.length());
            }
            default -> throw unexpected(msg, state);
        }
    }

    private void startAckTimer(ChannelHandlerContext ctx) {
        if (ackPeriodSeconds > 0) {
            ackTask = ctx.executor().scheduleAtFixedRate(link::sendAck,
                    ackPeriodSeconds, ackPeriodSeconds, TimeUnit.SECONDS);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            log.warn("Master link I/O error: {}", cause.getMessage());
        } else {
            log.warn("Master link failed in state {}: {}", link.getState(), cause.getMessage());
        }
        ctx.close();
    }

    private static boolean isCommand(RedisMessage msg) {
        if (!(msg instanceof RedisArray array) || array.size() == 0) {
            return false;
        }
        for (RedisMessage element : array.elements()) {
            if (!(element instanceof BulkString bulk) || bulk.isNull()) {
                return false;
            }
        }
        return true;
    }

    private static void expectSimple(RedisMessage msg, String expected, ReplState state) {
        if (!(msg instanceof SimpleString ss) || !expected.equalsIgnoreCase(ss.content())) {
            throw unexpected(msg, state);
        }
    }

    private static ReplicationHandshakeException unexpected(RedisMessage msg, ReplState state) {
        return new ReplicationHandshakeException("Unexpected reply from master in state " + state + ": " + msg);
    }
}
