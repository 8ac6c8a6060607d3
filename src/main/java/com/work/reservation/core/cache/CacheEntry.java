package com.work.reservation.core.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * 带 TTL 的缓存条目。invalidated 只表示“已过期需刷新”，值仍保留给 allow-stale 读取。
 */
public class CacheEntry {

    private final Object value;
    private final Instant cachedAt;
    private final Duration ttl;
    private final boolean invalidated;

    public CacheEntry(Object value, Instant cachedAt, Duration ttl, boolean invalidated) {
        this.value = value;
        this.cachedAt = cachedAt;
        this.ttl = ttl;
        this.invalidated = invalidated;
    }

    public Object getValue() {
        return value;
    }

    public Instant getCachedAt() {
        return cachedAt;
    }

    public Duration getTtl() {
        return ttl;
    }

    public boolean isInvalidated() {
        return invalidated;
    }

    public boolean isFresh(Instant now) {
        return !invalidated && now.isBefore(cachedAt.plus(ttl));
    }

    public CacheEntry markInvalidated() {
        return invalidated ? this : new CacheEntry(value, cachedAt, ttl, true);
    }
}
