package org.muma.kvlite.store;

import java.util.List;

/**
 * 带过期时间的 KV 存储。
 * 所有操作都是全函数：不会抛出业务异常，缺失即返回 null / 空列表。
 */
public interface KeyValueStore {

    /**
     * 写入 (覆盖) 一个 key，过期时间 = now + ttlMillis。
     * ttlMillis 为 {@link Long#MAX_VALUE} 时视为永不过期。
     */
    void set(String key, byte[] value, long ttlMillis);

    /**
     * 读取 key。已过期的 key 会在这里被惰性删除。
     *
     * @return 存储的值，不存在或已过期时返回 null
     */
    byte[] get(String key);

    /**
     * 列出所有未过期的 key，目前只支持 "*"，其他模式返回空列表。顺序不保证。
     */
    List<String> keys(String pattern);

    /**
     * 底层条目数，包含已过期但尚未被读到的条目
     */
    int size();
}
