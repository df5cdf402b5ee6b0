package org.muma.minikv.common;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 存储条目：值 + 可选的绝对过期时间
 * 覆盖写入时整体替换，不做原地修改
 */
@Getter
@AllArgsConstructor
public class RedisData {

    public static final long NO_EXPIRE = -1;

    private final byte[] value;

    // 过期时间戳，毫秒 (-1 表示不过期)
    private final long expireAt;

    public RedisData(byte[] value) {
        this(value, NO_EXPIRE);
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    // expireAt <= now 即视为过期
    public boolean isExpired(long now) {
        return expireAt != NO_EXPIRE && expireAt <= now;
    }
}
