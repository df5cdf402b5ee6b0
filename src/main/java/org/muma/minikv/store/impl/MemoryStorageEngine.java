package org.muma.minikv.store.impl;

import org.muma.minikv.common.RedisData;
import org.muma.minikv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // 每轮最多扫描 20 个 Key (防止卡顿)
    private static final int EXPIRE_SAMPLE_SIZE = 20;

    // 1. 数据存储 (Key -> Data)
    private final Map<String, RedisData> memoryDb = new ConcurrentHashMap<>();

    // 2. 过期时间存储 (Key -> ExpireAt Timestamp)
    // 专门维护这个 Map，可以让清理任务只关注需要过期的 Key
    private final Map<String, Long> ttlMap = new ConcurrentHashMap<>();

    @Override
    public RedisData get(String key, long now) {
        RedisData data = memoryDb.get(key);
        if (data == null) return null;

        // 惰性删除 (Lazy Expiration)
        if (data.isExpired(now)) {
            remove(key);
            return null;
        }
        return data;
    }

    @Override
    public void set(String key, byte[] value, long expireAt) {
        memoryDb.put(key, new RedisData(value, expireAt));
        // 有过期时间记录到 ttlMap；没有则移除 (可能由有过期变为无过期)
        if (expireAt != RedisData.NO_EXPIRE) {
            ttlMap.put(key, expireAt);
        } else {
            ttlMap.remove(key);
        }
    }

    @Override
    public boolean remove(String key) {
        ttlMap.remove(key); // 同步移除 TTL
        return memoryDb.remove(key) != null;
    }

    @Override
    public Set<String> keys(long now) {
        Set<String> live = new HashSet<>();
        for (Map.Entry<String, RedisData> entry : memoryDb.entrySet()) {
            if (!entry.getValue().isExpired(now)) {
                live.add(entry.getKey());
            }
        }
        return live;
    }

    @Override
    public void flush() {
        memoryDb.clear();
        ttlMap.clear();
    }

    @Override
    public int size() {
        return memoryDb.size();
    }

    /**
     * 定期删除策略 (简化版 Redis 算法)
     * ConcurrentHashMap 的迭代器是弱一致性的，且不保证随机，顺序扫描对清理任务来说可以接受
     */
    @Override
    public int activeExpireCycle(long now) {
        if (ttlMap.isEmpty()) return 0;

        int expiredCount = 0;
        int loop = 0;
        Iterator<Map.Entry<String, Long>> iterator = ttlMap.entrySet().iterator();
        while (iterator.hasNext() && loop < EXPIRE_SAMPLE_SIZE) {
            Map.Entry<String, Long> entry = iterator.next();
            if (entry.getValue() <= now) {
                memoryDb.remove(entry.getKey());
                iterator.remove();
                expiredCount++;
            }
            loop++;
        }

        if (expiredCount > 0) {
            log.debug("Active cleanup: scanned {}, expired {}", loop, expiredCount);
        }
        return expiredCount;
    }
}
