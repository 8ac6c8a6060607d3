package com.work.reservation.core.model;

import java.time.Instant;

/**
 * 本地乐观覆盖条目。只要条目存在，无论 pending 与否都覆盖服务端值。
 *
 * @param <V> 期望值类型（listing 为 Boolean，通用状态为字段 Map）
 */
public class OptimisticEntry<V> {

    private final String entityId;
    private final String kind;
    private final V desiredValue;
    private final boolean pending;
    private final String operation;
    private final Instant createdAt;
    private final Instant completedAt;

    public OptimisticEntry(String entityId, String kind, V desiredValue, boolean pending,
                           String operation, Instant createdAt, Instant completedAt) {
        this.entityId = entityId;
        this.kind = kind;
        this.desiredValue = desiredValue;
        this.pending = pending;
        this.operation = operation;
        this.createdAt = createdAt;
        this.completedAt = completedAt;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getKind() {
        return kind;
    }

    public V getDesiredValue() {
        return desiredValue;
    }

    public boolean isPending() {
        return pending;
    }

    public String getOperation() {
        return operation;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public OptimisticEntry<V> completed(Instant at) {
        return new OptimisticEntry<>(entityId, kind, desiredValue, false, operation, createdAt, at);
    }
}
