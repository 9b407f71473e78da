package org.muma.kvlite.rdb;

/**
 * RDB 中解析出的一条 key-value 记录
 *
 * @param expiresAt 绝对过期时间 (毫秒时间戳)，只有 hasExpiry 为 true 时有意义
 */
public record SnapshotRecord(String key, byte[] value, boolean hasExpiry, long expiresAt) {

    public static SnapshotRecord persistent(String key, byte[] value) {
        return new SnapshotRecord(key, value, false, 0L);
    }

    public static SnapshotRecord expiring(String key, byte[] value, long expiresAt) {
        return new SnapshotRecord(key, value, true, expiresAt);
    }
}
