package org.muma.minikv.protocol;

/**
 * 解码结果 + 该帧在线路上实际占用的字节数
 * 只在 Slave 连接 Master 的链路上使用，用于维护复制偏移量
 */
public record RespFrame(RedisMessage message, int length) {
}
