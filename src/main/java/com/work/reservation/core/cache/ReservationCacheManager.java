package com.work.reservation.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 封装 Caffeine 缓存，提供 TTL 判断、allow-stale 读取与按分区失效。
 *
 * TTL 由条目自身判断；Caffeine 的 expireAfterWrite 只作为硬上限（应急 TTL），
 * 保证降级期间还能读到旧值，同时内存有界。
 */
public class ReservationCacheManager {

    private static final Logger log = LoggerFactory.getLogger(ReservationCacheManager.class);

    private final Cache<String, CacheEntry> cache;
    private final Clock clock;

    public ReservationCacheManager(long maximumSize, Duration hardExpiry, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ValidationUtils.requirePositive(hardExpiry, "hardExpiry"))
                .build();
    }

    /**
     * 读取缓存值。allowStale=false 时只返回新鲜值；allowStale=true 时已过期/已失效的旧值也返回。
     * 类型不符按未命中处理。
     */
    public <T> Optional<T> get(String key, Class<T> type, boolean allowStale) {
        return lookup(key, allowStale).filter(type::isInstance).map(type::cast);
    }

    /**
     * 列表值的读取，逐个元素校验类型，返回不可变副本。
     */
    public <E> Optional<List<E>> getList(String key, Class<E> elementType, boolean allowStale) {
        Optional<Object> value = lookup(key, allowStale);
        if (!value.isPresent() || !(value.get() instanceof List)) {
            return Optional.empty();
        }
        List<E> out = new ArrayList<>();
        for (Object o : (List<?>) value.get()) {
            if (!elementType.isInstance(o)) {
                log.warn("cache value type mismatch key={} expected={}", key, elementType.getSimpleName());
                return Optional.empty();
            }
            out.add(elementType.cast(o));
        }
        return Optional.of(Collections.unmodifiableList(out));
    }

    private Optional<Object> lookup(String key, boolean allowStale) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!allowStale && !entry.isFresh(clock.instant())) {
            return Optional.empty();
        }
        return Optional.ofNullable(entry.getValue());
    }

    public void put(String key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        cache.put(key, new CacheEntry(value, clock.instant(), ttl, false));
    }

    /**
     * 标记失效（保留旧值）。
     */
    public void invalidate(String key) {
        cache.asMap().computeIfPresent(key, (k, e) -> e.markInvalidated());
    }

    /**
     * 失效 base 以及 "base:" 前缀下的全部条目。
     *
     * @return 受影响条目数
     */
    public int invalidatePartition(String base) {
        int n = 0;
        String prefix = base + ":";
        for (String key : cache.asMap().keySet()) {
            if (key.equals(base) || key.startsWith(prefix)) {
                invalidate(key);
                n++;
            }
        }
        return n;
    }

    public int invalidateReservation(ReservationKey key) {
        return invalidatePartition(CacheKeys.reservation(key));
    }

    public int invalidateToken(String tokenId) {
        return tokenId == null ? 0 : invalidatePartition(CacheKeys.token(tokenId));
    }

    public int invalidateUser(String address) {
        return address == null ? 0 : invalidatePartition(CacheKeys.user(address));
    }

    public int invalidateSession() {
        return invalidatePartition(CacheKeys.SESSION);
    }

    public void invalidateBookingLists() {
        invalidate(CacheKeys.ALL_BOOKINGS);
    }

    public long size() {
        return cache.estimatedSize();
    }

    public boolean isFresh(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        Instant now = clock.instant();
        boolean fresh = entry != null && entry.isFresh(now);
        if (log.isTraceEnabled()) {
            log.trace("cache freshness key={} fresh={}", key, fresh);
        }
        return fresh;
    }
}
