package org.muma.kvlite.store.impl;

import org.muma.kvlite.rdb.SnapshotRecord;
import org.muma.kvlite.store.KeyValueStore;
import org.muma.kvlite.store.StoredEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

/**
 * 内存存储 + 惰性过期 (Lazy Expiration)
 * <p>
 * 单写多读：set 和触发过期删除的 get 走写锁，普通 get / keys 走读锁。
 * 没有后台清理线程，过期但从未被读到的 key 会一直留在内存里，直到被覆盖或被 get 删除。
 */
public class ExpiringMemoryStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(ExpiringMemoryStore.class);

    public static final String MATCH_ALL = "*";

    private final Map<String, StoredEntry> memoryDb = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final LongSupplier clock;

    public ExpiringMemoryStore() {
        this(Collections.emptyMap());
    }

    public ExpiringMemoryStore(Map<String, SnapshotRecord> snapshot) {
        this(snapshot, System::currentTimeMillis);
    }

    public ExpiringMemoryStore(Map<String, SnapshotRecord> snapshot, LongSupplier clock) {
        this.clock = clock;
        // 构造阶段还没有并发访问，不需要加锁
        for (SnapshotRecord record : snapshot.values()) {
            long expiresAt = record.hasExpiry() ? record.expiresAt() : StoredEntry.NEVER_EXPIRES;
            memoryDb.put(record.key(), new StoredEntry(record.value(), expiresAt));
        }
        if (!memoryDb.isEmpty()) {
            log.info("Store seeded from snapshot with {} keys", memoryDb.size());
        }
    }

    @Override
    public void set(String key, byte[] value, long ttlMillis) {
        long expiresAt = StoredEntry.expiresAtFrom(clock.getAsLong(), ttlMillis);
        lock.writeLock().lock();
        try {
            memoryDb.put(key, new StoredEntry(value, expiresAt));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public byte[] get(String key) {
        lock.readLock().lock();
        try {
            StoredEntry entry = memoryDb.get(key);
            if (entry == null) {
                return null;
            }
            if (!entry.isExpiredAt(clock.getAsLong())) {
                return entry.value();
            }
        } finally {
            lock.readLock().unlock();
        }

        // 读锁不能直接升级为写锁，释放后重新获取，并再检查一次 (期间可能被 set 覆盖)
        lock.writeLock().lock();
        try {
            StoredEntry entry = memoryDb.get(key);
            if (entry == null) {
                return null;
            }
            if (!entry.isExpiredAt(clock.getAsLong())) {
                return entry.value();
            }
            memoryDb.remove(key);
            log.debug("Lazy expire: {}", key);
            return null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> keys(String pattern) {
        if (!MATCH_ALL.equals(pattern)) {
            // 其余模式在命令层已经拦截
            log.debug("Unsupported keys pattern '{}', returning nothing", pattern);
            return List.of();
        }
        lock.readLock().lock();
        try {
            long now = clock.getAsLong();
            List<String> result = new ArrayList<>(memoryDb.size());
            for (Map.Entry<String, StoredEntry> e : memoryDb.entrySet()) {
                if (!e.getValue().isExpiredAt(now)) {
                    result.add(e.getKey());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return memoryDb.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
