package org.muma.minikv.protocol;

import java.util.Arrays;

/**
 * 5. 数组 (*) - elements 为 null 表示 *-1
 * <p>
 * 构造时复制一份元素数组且不允许 null 元素；elements() 返回内部数组，调用方只读
 */
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public RedisArray {
        if (elements != null) {
            elements = elements.clone();
            for (int i = 0; i < elements.length; i++) {
                if (elements[i] == null) {
                    throw new IllegalArgumentException("Array element " + i + " is null, use BulkString.NULL");
                }
            }
        }
    }

    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);

    /**
     * 由字符串参数构建命令数组，所有元素均为 BulkString
     */
    public static RedisArray of(String... parts) {
        RedisMessage[] msgs = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            msgs[i] = new BulkString(parts[i]);
        }
        return new RedisArray(msgs);
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RedisArray other && Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return "RedisArray" + (elements == null ? "[nil]" : Arrays.toString(elements));
    }
}
