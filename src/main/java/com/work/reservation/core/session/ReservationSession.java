package com.work.reservation.core.session;

import com.work.reservation.core.notify.NotificationDeduper;
import com.work.reservation.core.optimistic.OptimisticUiState;
import com.work.reservation.core.pending.PendingActionTracker;
import com.work.reservation.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 会话级上下文：在途动作、通知门、乐观覆盖层与会话身份。
 *
 * 这些状态都是可丢弃、可重建的缓存，唯一真相在链上。以显式对象注入而不是静态全局，
 * 不同实例（包括测试）之间互不共享状态。
 */
public class ReservationSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReservationSession.class);

    private final SessionIdentity identity;
    private final PendingActionTracker pendingActions;
    private final NotificationDeduper notificationGate;
    private final OptimisticUiState optimisticState;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ReservationSession(Clock clock, SessionIdentity identity) {
        ValidationUtils.requireNonNull(clock, "clock");
        this.identity = ValidationUtils.requireNonNull(identity, "identity");
        this.pendingActions = new PendingActionTracker(clock);
        this.notificationGate = new NotificationDeduper();
        this.optimisticState = new OptimisticUiState(clock);
    }

    public SessionIdentity getIdentity() {
        return identity;
    }

    public PendingActionTracker getPendingActions() {
        return pendingActions;
    }

    public NotificationDeduper getNotificationGate() {
        return notificationGate;
    }

    public OptimisticUiState getOptimisticState() {
        return optimisticState;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Reservation session closed. pending={} notified={} optimistic={}",
                pendingActions.size(), notificationGate.size(), optimisticState.size());
        pendingActions.clear();
        notificationGate.reset();
        optimisticState.clearAll();
    }
}
