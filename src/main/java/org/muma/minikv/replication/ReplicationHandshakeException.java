package org.muma.minikv.replication;

/**
 * 复制握手失败：Master 不可达，或者握手过程中收到了意料之外的回复
 */
public class ReplicationHandshakeException extends RuntimeException {

    public ReplicationHandshakeException(String message) {
        super(message);
    }

    public ReplicationHandshakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
