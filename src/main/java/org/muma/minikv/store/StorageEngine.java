package org.muma.minikv.store;

import org.muma.minikv.common.RedisData;

import java.util.Set;

/**
 * 键值存储
 * <p>
 * 所有方法的当前时间都由调用方传入，存储本身不读时钟。
 * 并发纪律由调用方保证：所有访问都在 RedisCoreExecutor 单线程中进行。
 */
public interface StorageEngine {

    /**
     * @return 未过期的条目，不存在或已过期返回 null
     */
    RedisData get(String key, long now);

    /**
     * @param expireAt 绝对过期时间 (毫秒)，-1 表示不过期
     */
    void set(String key, byte[] value, long expireAt);

    /**
     * @return 删除前 key 是否存在 (不检查过期)
     */
    boolean remove(String key);

    /**
     * 所有未过期的 key
     */
    Set<String> keys(long now);

    // 清空数据 (全量同步时使用)
    void flush();

    /**
     * 物理条目数，包含尚未清理的过期条目
     */
    int size();

    /**
     * 定期删除：抽样检查一部分带过期时间的 key
     *
     * @return 本轮删除的 key 数量
     */
    int activeExpireCycle(long now);
}
