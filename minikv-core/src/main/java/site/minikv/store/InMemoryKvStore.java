package site.minikv.store;

import lombok.extern.slf4j.Slf4j;
import site.minikv.datastructure.KvBytes;
import site.minikv.datastructure.KvValue;
import site.minikv.datastructure.SortedSetValue;
import site.minikv.datastructure.StringValue;
import site.minikv.internal.GlobPattern;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 基于单个读写锁的内存存储
 *
 * <p>所有键保存在同一个键空间中，字符串与有序集合共享键名，
 * 过期时间附着在值上。
 *
 * <p>并发模型：
 * <ul>
 *     <li>GET/KEYS/TTL/ZRANGE/ZCARD/DBSIZE 持有读锁，可并行执行</li>
 *     <li>SET/DEL/EXPIRE/ZADD 持有写锁，与其他任何操作互斥</li>
 *     <li>读路径发现过期键时先释放读锁，再获取写锁重新检查后删除</li>
 * </ul>
 *
 * @author minikv
 * @since 1.0.0
 */
@Slf4j
public class InMemoryKvStore implements KvStore {

    private final Map<KvBytes, KvValue> keyspace = new HashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final KvClock clock;

    public InMemoryKvStore() {
        this(KvClock.SYSTEM);
    }

    public InMemoryKvStore(final KvClock clock) {
        this.clock = clock;
    }

    @Override
    public boolean set(final KvBytes key, final KvBytes value, final SetOptions options) {
        lock.writeLock().lock();
        try {
            final long now = clock.currentTimeMillis();
            final KvValue existing = liveValue(key, now);
            switch (options.getCondition()) {
                case NX:
                    if (existing != null) {
                        return false;
                    }
                    break;
                case XX:
                    if (existing == null) {
                        return false;
                    }
                    break;
                default:
                    break;
            }
            final long expireAt = options.hasExpire()
                    ? expireAtFrom(now, options.getExpireSeconds())
                    : KvValue.NO_EXPIRE;
            keyspace.put(key, new StringValue(value, expireAt));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public KvBytes get(final KvBytes key) {
        lock.readLock().lock();
        try {
            final KvValue value = keyspace.get(key);
            if (value == null) {
                return null;
            }
            if (!value.isExpiredAt(clock.currentTimeMillis())) {
                return asString(value).getValue();
            }
        } finally {
            lock.readLock().unlock();
        }
        evictIfExpired(key);
        return null;
    }

    @Override
    public long del(final Collection<KvBytes> keys) {
        lock.writeLock().lock();
        try {
            final long now = clock.currentTimeMillis();
            long removed = 0;
            for (final KvBytes key : keys) {
                final KvValue value = keyspace.remove(key);
                if (value != null && !value.isExpiredAt(now)) {
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<KvBytes> keys(final KvBytes pattern) {
        final GlobPattern glob = GlobPattern.compile(pattern);
        final List<KvBytes> result = new ArrayList<>();
        final List<KvBytes> expired = new ArrayList<>();

        lock.readLock().lock();
        try {
            final long now = clock.currentTimeMillis();
            if (glob.isLiteral()) {
                final KvValue value = keyspace.get(pattern);
                if (value != null) {
                    (value.isExpiredAt(now) ? expired : result).add(pattern);
                }
            } else {
                for (final Map.Entry<KvBytes, KvValue> entry : keyspace.entrySet()) {
                    if (entry.getValue().isExpiredAt(now)) {
                        expired.add(entry.getKey());
                    } else if (glob.matches(entry.getKey())) {
                        result.add(entry.getKey());
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        for (final KvBytes key : expired) {
            evictIfExpired(key);
        }
        return result;
    }

    @Override
    public boolean expire(final KvBytes key, final long seconds) {
        lock.writeLock().lock();
        try {
            final long now = clock.currentTimeMillis();
            final KvValue value = liveValue(key, now);
            if (value == null) {
                return false;
            }
            if (seconds <= 0) {
                keyspace.remove(key);
                log.debug("键 {} 的过期时间不为正，立即删除", key);
                return true;
            }
            value.setExpireAt(expireAtFrom(now, seconds));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long ttl(final KvBytes key) {
        lock.readLock().lock();
        try {
            final KvValue value = keyspace.get(key);
            if (value == null) {
                return -2;
            }
            final long now = clock.currentTimeMillis();
            if (!value.isExpiredAt(now)) {
                if (value.expireAt() == KvValue.NO_EXPIRE) {
                    return -1;
                }
                final long remainingMillis = value.expireAt() - now;
                return (remainingMillis + 500) / 1000;
            }
        } finally {
            lock.readLock().unlock();
        }
        evictIfExpired(key);
        return -2;
    }

    @Override
    public boolean zadd(final KvBytes key, final double score, final KvBytes member) {
        lock.writeLock().lock();
        try {
            final KvValue value = liveValue(key, clock.currentTimeMillis());
            final SortedSetValue zset;
            if (value == null) {
                zset = new SortedSetValue();
                keyspace.put(key, zset);
            } else {
                zset = asSortedSet(value);
            }
            return zset.add(member, score);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<KvBytes> zrange(final KvBytes key, final long start, final long stop) {
        lock.readLock().lock();
        try {
            final KvValue value = keyspace.get(key);
            if (value == null) {
                return Collections.emptyList();
            }
            if (!value.isExpiredAt(clock.currentTimeMillis())) {
                return asSortedSet(value).range(start, stop);
            }
        } finally {
            lock.readLock().unlock();
        }
        evictIfExpired(key);
        return Collections.emptyList();
    }

    @Override
    public long zcard(final KvBytes key) {
        lock.readLock().lock();
        try {
            final KvValue value = keyspace.get(key);
            if (value == null || value.isExpiredAt(clock.currentTimeMillis())) {
                return 0;
            }
            return asSortedSet(value).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long dbsize() {
        lock.readLock().lock();
        try {
            final long now = clock.currentTimeMillis();
            long count = 0;
            for (final KvValue value : keyspace.values()) {
                if (!value.isExpiredAt(now)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 获取未过期的值，已过期的键在此处被删除，调用方必须持有写锁
     */
    private KvValue liveValue(final KvBytes key, final long now) {
        final KvValue value = keyspace.get(key);
        if (value == null) {
            return null;
        }
        if (value.isExpiredAt(now)) {
            keyspace.remove(key);
            log.debug("惰性删除过期键 {} ({})", key, value.typeName());
            return null;
        }
        return value;
    }

    /**
     * 读路径发现过期后调用，获取写锁后重新检查，期间键可能已被重新写入
     */
    private void evictIfExpired(final KvBytes key) {
        lock.writeLock().lock();
        try {
            liveValue(key, clock.currentTimeMillis());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static long expireAtFrom(final long now, final long seconds) {
        if (seconds > (Long.MAX_VALUE - now) / 1000) {
            return Long.MAX_VALUE;
        }
        return now + seconds * 1000;
    }

    private static StringValue asString(final KvValue value) {
        if (!(value instanceof StringValue)) {
            throw new WrongTypeException();
        }
        return (StringValue) value;
    }

    private static SortedSetValue asSortedSet(final KvValue value) {
        if (!(value instanceof SortedSetValue)) {
            throw new WrongTypeException();
        }
        return (SortedSetValue) value;
    }
}
