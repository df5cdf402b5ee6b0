package org.muma.minikv.replication;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * Master 端的一个 Slave 连接
 * <p>
 * 从第一条 REPLCONF 开始建立，连接断开时注销。只在核心线程中修改状态。
 */
@Getter
public class ReplicaHandle {

    private static final Logger log = LoggerFactory.getLogger(ReplicaHandle.class);

    private final Channel channel;
    private SlaveState state = SlaveState.AWAITING_HANDSHAKE;

    private int listeningPort = -1;
    private boolean capaSeen;

    // 只由 REPLCONF ACK 更新
    @Setter
    private volatile long ackOffset;

    public ReplicaHandle(Channel channel) {
        this.channel = channel;
    }

    public void onListeningPort(int port) {
        this.listeningPort = port;
        advanceHandshake();
    }

    public void onCapa() {
        this.capaSeen = true;
        advanceHandshake();
    }

    // listening-port 和 capa 都收到后才允许 PSYNC
    private void advanceHandshake() {
        if (state == SlaveState.AWAITING_HANDSHAKE && listeningPort > 0 && capaSeen) {
            state = SlaveState.AWAITING_PSYNC;
        }
    }

    void markStreaming() {
        this.state = SlaveState.STREAMING;
    }

    /**
     * 发送已编码好的命令字节，写失败直接断开连接 (由断开回调注销)
     */
    public void send(byte[] command) {
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(Unpooled.wrappedBuffer(command)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to write to replica {}, closing link", describe(), future.cause());
                future.channel().close();
            }
        });
    }

    public String ip() {
        SocketAddress address = channel.remoteAddress();
        if (address instanceof InetSocketAddress inet) {
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return "?";
    }

    public String describe() {
        return ip() + ":" + listeningPort;
    }
}
