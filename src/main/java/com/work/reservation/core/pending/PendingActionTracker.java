package com.work.reservation.core.pending;

import com.work.reservation.core.model.PendingAction;
import com.work.reservation.core.model.PendingActionKind;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.support.LedgerValues;
import com.work.reservation.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本会话发起的在途预约动作跟踪。每个 (key, kind) 至多一条。
 *
 * 条目在以下情况删除：
 * - 对账定案（{@link #resolve(ReservationKey)}）
 * - 超过超时时间（{@link #evictOlderThan(Duration)}，由兜底轮询驱动）
 */
public class PendingActionTracker {

    private static final Logger log = LoggerFactory.getLogger(PendingActionTracker.class);

    private final Clock clock;
    private final Map<String, PendingAction> actions = new ConcurrentHashMap<>();

    public PendingActionTracker(Clock clock) {
        this.clock = ValidationUtils.requireNonNull(clock, "clock");
    }

    /**
     * 无条件插入/覆盖，attempts 归零。提交交易时调用。
     */
    public PendingAction track(ReservationKey key, Object tokenId, String requester, PendingActionKind kind) {
        ValidationUtils.requireNonNull(key, "reservationKey");
        ValidationUtils.requireNonNull(kind, "kind");
        PendingAction action = new PendingAction(key, LedgerValues.tokenId(tokenId), LedgerValues.address(requester),
                kind, clock.instant(), 0);
        actions.put(id(key, kind), action);
        log.debug("[pending] track {}", action);
        return action;
    }

    /**
     * 防御式 upsert：已存在时保留 createdAt/attempts，只补齐此前缺失的字段。
     * 用于事件只带部分上下文时补登记。
     */
    public PendingAction register(ReservationKey key, Object tokenId, String requester, PendingActionKind kind) {
        ValidationUtils.requireNonNull(key, "reservationKey");
        ValidationUtils.requireNonNull(kind, "kind");
        String token = LedgerValues.tokenId(tokenId);
        String addr = LedgerValues.address(requester);
        return actions.compute(id(key, kind), (k, cur) -> {
            if (cur == null) {
                return new PendingAction(key, token, addr, kind, clock.instant(), 0);
            }
            return new PendingAction(key,
                    cur.getTokenId() != null ? cur.getTokenId() : token,
                    cur.getRequesterAddress() != null ? cur.getRequesterAddress() : addr,
                    kind, cur.getCreatedAt(), cur.getAttempts());
        });
    }

    public PendingAction get(ReservationKey key, PendingActionKind kind) {
        if (key == null || kind == null) {
            return null;
        }
        return actions.get(id(key, kind));
    }

    /**
     * 任一类型的在途动作（确认优先）。
     */
    public PendingAction find(ReservationKey key) {
        if (key == null) {
            return null;
        }
        PendingAction confirmation = actions.get(id(key, PendingActionKind.CONFIRMATION));
        return confirmation != null ? confirmation : actions.get(id(key, PendingActionKind.CANCELLATION));
    }

    public boolean isTracked(ReservationKey key, PendingActionKind kind) {
        return get(key, kind) != null;
    }

    /**
     * 定案：删除该 key 的所有在途动作，返回被删除的条目。
     */
    public List<PendingAction> resolve(ReservationKey key) {
        List<PendingAction> removed = new ArrayList<>(2);
        if (key == null) {
            return removed;
        }
        for (PendingActionKind kind : PendingActionKind.values()) {
            PendingAction a = actions.remove(id(key, kind));
            if (a != null) {
                removed.add(a);
            }
        }
        return removed;
    }

    public boolean remove(ReservationKey key, PendingActionKind kind) {
        return key != null && kind != null && actions.remove(id(key, kind)) != null;
    }

    /**
     * 查询失败时 attempts+1，条目不删除。
     *
     * @return 递增后的 attempts；条目已不存在时返回 -1
     */
    public int recordFailedAttempt(ReservationKey key, PendingActionKind kind) {
        PendingAction updated = actions.computeIfPresent(id(key, kind), (k, cur) -> cur.withAttempts(cur.getAttempts() + 1));
        return updated == null ? -1 : updated.getAttempts();
    }

    public List<PendingAction> snapshot() {
        return new ArrayList<>(actions.values());
    }

    /**
     * 淘汰超过 timeout 的条目（无论是否观察到定案）。
     */
    public int evictOlderThan(Duration timeout) {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<String, PendingAction> e : actions.entrySet()) {
            if (isExpired(e.getValue(), timeout, now) && actions.remove(e.getKey(), e.getValue())) {
                evicted++;
            }
        }
        return evicted;
    }

    public boolean isExpired(PendingAction action, Duration timeout, Instant now) {
        return Duration.between(action.getCreatedAt(), now).compareTo(timeout) > 0;
    }

    public int size() {
        return actions.size();
    }

    public void clear() {
        actions.clear();
    }

    private static String id(ReservationKey key, PendingActionKind kind) {
        return kind.name() + ':' + key.value();
    }
}
