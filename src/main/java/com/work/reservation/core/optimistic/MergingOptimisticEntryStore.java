package com.work.reservation.core.optimistic;

import com.work.reservation.core.model.OptimisticEntry;
import com.work.reservation.core.support.ValidationUtils;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 多字段实体的“通用状态”变体：set 时按字段浅合并，而不是整体覆盖。
 *
 * 字段 isPending 决定条目的 pending 标记；未携带时沿用旧值（新条目视为非 pending）。
 */
public class MergingOptimisticEntryStore extends OptimisticEntryStore<Map<String, Object>> {

    public static final String PENDING_FIELD = "isPending";

    public MergingOptimisticEntryStore(String kind, Clock clock) {
        super(kind, clock);
    }

    public OptimisticEntry<Map<String, Object>> merge(String entityId, Map<String, Object> fields) {
        String key = ValidationUtils.requireEntityId(entityId, "entityId");
        Map<String, Object> patch = fields == null ? Collections.emptyMap() : fields;
        return entries.compute(key, (k, cur) -> {
            Map<String, Object> merged = new LinkedHashMap<>();
            if (cur != null && cur.getDesiredValue() != null) {
                merged.putAll(cur.getDesiredValue());
            }
            merged.putAll(patch);
            boolean pending;
            if (patch.containsKey(PENDING_FIELD)) {
                pending = Boolean.TRUE.equals(patch.get(PENDING_FIELD));
            } else {
                pending = cur != null && cur.isPending();
            }
            Object op = merged.get("operation");
            return new OptimisticEntry<>(k, kind, Collections.unmodifiableMap(merged), pending,
                    op == null ? null : op.toString(), clock.instant(), null);
        });
    }

    @Override
    public void complete(String entityId) {
        if (entityId == null) {
            return;
        }
        entries.computeIfPresent(entityId.trim(), (k, cur) -> {
            Map<String, Object> fields = new LinkedHashMap<>(cur.getDesiredValue());
            fields.put(PENDING_FIELD, Boolean.FALSE);
            return new OptimisticEntry<>(k, kind, Collections.unmodifiableMap(fields), false,
                    cur.getOperation(), cur.getCreatedAt(), clock.instant());
        });
    }

    /**
     * 服务端字段 + 覆盖字段（覆盖优先）；服务端为空时按空 Map 处理。
     */
    public Map<String, Object> getEffectiveState(String entityId, Map<String, Object> serverState) {
        Map<String, Object> base = serverState == null ? Collections.emptyMap() : serverState;
        OptimisticEntry<Map<String, Object>> entry = get(entityId);
        if (entry == null) {
            return base;
        }
        Map<String, Object> effective = new LinkedHashMap<>(base);
        effective.putAll(entry.getDesiredValue());
        return effective;
    }
}
