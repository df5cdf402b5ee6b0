package org.muma.minikv.rdb;

import org.muma.minikv.common.RedisData;

/**
 * 快照中的一条记录
 *
 * @param expireAt 绝对过期时间 (毫秒)，-1 表示不过期
 */
public record RdbEntry(String key, byte[] value, long expireAt) {

    public boolean isExpired(long now) {
        return expireAt != RedisData.NO_EXPIRE && expireAt <= now;
    }
}
