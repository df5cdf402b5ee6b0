package org.muma.minikv.replication;

import lombok.Getter;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 复制元数据 (Master 侧)
 */
public class ReplicationMetadata {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    // 40 字节十六进制 ID
    @Getter
    private final String replId;

    // 全局复制偏移量：已传播的命令字节数
    private final AtomicLong replOffset = new AtomicLong(0);

    public ReplicationMetadata() {
        this(randomReplId());
    }

    public ReplicationMetadata(String replId) {
        this.replId = replId;
    }

    public long getReplOffset() {
        return replOffset.get();
    }

    public long addOffset(long delta) {
        return replOffset.addAndGet(delta);
    }

    static String randomReplId() {
        SecureRandom random = new SecureRandom();
        char[] id = new char[40];
        for (int i = 0; i < id.length; i++) {
            id[i] = HEX[random.nextInt(16)];
        }
        return new String(id);
    }
}
