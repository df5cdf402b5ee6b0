package org.muma.minikv.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 4. 批量字符串 ($) - 支持 null (表示 $-1)
 * <p>
 * 构造时复制传入的数组；content() 返回内部数组，调用方只读 (SET 直接把它存为 value)
 */
public record BulkString(byte[] content) implements RedisMessage {

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString {
        if (content != null) {
            content = content.clone();
        }
    }

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    public boolean isNull() {
        return content == null;
    }

    // record 默认对 byte[] 只比较引用，这里改成按内容比较
    @Override
    public boolean equals(Object o) {
        return o instanceof BulkString other && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "BulkString[" + (content == null ? "nil" : asString()) + "]";
    }
}
