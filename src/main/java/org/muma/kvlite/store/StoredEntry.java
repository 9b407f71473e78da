package org.muma.kvlite.store;

/**
 * 存储条目：值 + 绝对过期时间戳 (毫秒)。
 * 永不过期的 key 使用 {@link #NEVER_EXPIRES}，这样判断过期只需要一次比较。
 */
public record StoredEntry(byte[] value, long expiresAt) {

    public static final long NEVER_EXPIRES = Long.MAX_VALUE;

    public boolean isExpiredAt(long now) {
        return now >= expiresAt;
    }

    // now + ttl，溢出时截断到 NEVER_EXPIRES
    public static long expiresAtFrom(long now, long ttlMillis) {
        if (ttlMillis > 0 && now > NEVER_EXPIRES - ttlMillis) {
            return NEVER_EXPIRES;
        }
        return now + ttlMillis;
    }
}
