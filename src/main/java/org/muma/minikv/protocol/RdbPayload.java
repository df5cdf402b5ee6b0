package org.muma.minikv.protocol;

/**
 * 全量同步时 Master 发送的 RDB 快照: $&lt;len&gt;\r\n&lt;bytes&gt;
 * <p>
 * 与普通 BulkString 不同，末尾没有 CRLF。
 */
public record RdbPayload(byte[] content) implements RedisMessage {

    public int length() {
        return content.length;
    }

    @Override
    public String toString() {
        return "RdbPayload[" + content.length + " bytes]";
    }
}
