package org.muma.minikv.replication;

/**
 * Master 端为每个 Slave 连接维护的状态
 */
public enum SlaveState {
    AWAITING_HANDSHAKE, // 等待 REPLCONF listening-port + capa
    AWAITING_PSYNC,     // 握手完成，等待 PSYNC
    STREAMING           // 已发送快照，接收命令流
}
