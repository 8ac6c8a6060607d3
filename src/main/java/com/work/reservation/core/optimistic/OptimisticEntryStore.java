package com.work.reservation.core.optimistic;

import com.work.reservation.core.model.OptimisticEntry;
import com.work.reservation.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按实体维护的乐观覆盖层。
 *
 * - set：latest-wins 整体覆盖
 * - complete：pending=false，保留期望值
 * - clear：删除条目
 * - 不存在的 key 一律静默处理，不抛异常
 *
 * 过期清理不使用“每条一个定时器”，而是由外部以固定节奏调用 {@link #sweep(Duration, Duration)}。
 */
public class OptimisticEntryStore<V> {

    private static final Logger log = LoggerFactory.getLogger(OptimisticEntryStore.class);

    protected final String kind;
    protected final Clock clock;
    protected final Map<String, OptimisticEntry<V>> entries = new ConcurrentHashMap<>();

    public OptimisticEntryStore(String kind, Clock clock) {
        this.kind = ValidationUtils.requireNonEmpty(kind, "kind");
        this.clock = ValidationUtils.requireNonNull(clock, "clock");
    }

    public OptimisticEntry<V> set(String entityId, V desired, boolean pending, String operation) {
        String key = ValidationUtils.requireEntityId(entityId, "entityId");
        OptimisticEntry<V> entry = new OptimisticEntry<>(key, kind, desired, pending, operation, clock.instant(), null);
        entries.put(key, entry);
        log.debug("[optimistic] set kind={} id={} pending={} op={}", kind, key, pending, operation);
        return entry;
    }

    public void complete(String entityId) {
        if (entityId == null) {
            return;
        }
        Instant now = clock.instant();
        entries.computeIfPresent(entityId.trim(), (k, cur) -> cur.completed(now));
    }

    public boolean clear(String entityId) {
        if (entityId == null) {
            return false;
        }
        return entries.remove(entityId.trim()) != null;
    }

    public OptimisticEntry<V> get(String entityId) {
        if (entityId == null) {
            return null;
        }
        return entries.get(entityId.trim());
    }

    public boolean contains(String entityId) {
        return get(entityId) != null;
    }

    /**
     * 一次遍历清理过期条目：pending 条目按创建时间计 pendingMaxAge，已完成条目按完成时间计 completedMaxAge。
     *
     * @return 本次清理的条目数
     */
    public int sweep(Duration pendingMaxAge, Duration completedMaxAge) {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<String, OptimisticEntry<V>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, OptimisticEntry<V>> e = it.next();
            OptimisticEntry<V> entry = e.getValue();
            if (isExpired(entry, now, pendingMaxAge, completedMaxAge)) {
                // 并发下只删除当前看到的那个版本，避免误删刚被重新 set 的条目
                if (entries.remove(e.getKey(), entry)) {
                    removed++;
                    log.debug("[optimistic] auto-clean {} {} state id={}", entry.isPending() ? "pending" : "completed", kind, e.getKey());
                }
            }
        }
        return removed;
    }

    private boolean isExpired(OptimisticEntry<V> entry, Instant now, Duration pendingMaxAge, Duration completedMaxAge) {
        if (entry.isPending()) {
            return !now.isBefore(entry.getCreatedAt().plus(pendingMaxAge));
        }
        Instant base = entry.getCompletedAt() != null ? entry.getCompletedAt() : entry.getCreatedAt();
        return !now.isBefore(base.plus(completedMaxAge));
    }

    public int size() {
        return entries.size();
    }

    public String getKind() {
        return kind;
    }

    public void clearAll() {
        entries.clear();
    }
}
