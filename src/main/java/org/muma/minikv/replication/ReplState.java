package org.muma.minikv.replication;

/**
 * Slave 端 Master 链路的状态机
 */
public enum ReplState {
    NONE,               // 尚未启动
    CONNECTING,         // TCP 连接中
    SENT_PING,          // 已发送 PING，等待 PONG
    SENT_REPLCONF_PORT, // 已发送 REPLCONF listening-port，等待 OK
    SENT_REPLCONF_CAPA, // 已发送 REPLCONF capa，等待 OK
    SENT_PSYNC,         // 已发送 PSYNC，等待 FULLRESYNC
    LOADING_SNAPSHOT,   // 等待并加载 RDB
    STREAMING,          // 全量同步完成，接收命令流
    DISCONNECTED        // 链路断开，等待重连
}
