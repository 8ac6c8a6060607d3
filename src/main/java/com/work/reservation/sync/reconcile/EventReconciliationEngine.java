package com.work.reservation.sync.reconcile;

import com.work.reservation.core.cache.ReservationCacheManager;
import com.work.reservation.core.ledger.LedgerLog;
import com.work.reservation.core.model.NotificationLevel;
import com.work.reservation.core.model.PendingAction;
import com.work.reservation.core.model.PendingActionKind;
import com.work.reservation.core.model.ReservationEvent;
import com.work.reservation.core.model.ReservationEventType;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.core.model.ReservationSignal;
import com.work.reservation.core.model.SignalType;
import com.work.reservation.core.model.UserNotification;
import com.work.reservation.core.notify.NotificationDeduper;
import com.work.reservation.core.notify.ReservationSignalPublisher;
import com.work.reservation.core.notify.UserNotifier;
import com.work.reservation.core.optimistic.OptimisticUiState;
import com.work.reservation.core.pending.PendingActionTracker;
import com.work.reservation.core.session.ReservationSession;
import com.work.reservation.core.session.SessionIdentity;
import com.work.reservation.core.support.LedgerValues;
import com.work.reservation.core.support.ValidationUtils;
import com.work.reservation.sync.config.ReservationSyncProperties;
import com.work.reservation.sync.refresh.CachedReservationReader;
import com.work.reservation.sync.support.metrics.ReservationSyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * 事件对账引擎：把一条定案（来自事件订阅或兜底轮询）落到本地状态上。
 *
 * 每次对账按固定顺序执行：
 * 1) 判定归属（在途动作 &gt; 事件 renter &gt; 可选的链上详情读取）
 * 2) 失效相关缓存分区（预约、token、renter、本会话用户、会话级条目与列表）
 * 3) 清除该预约的乐观覆盖层
 * 4) 终态事件结束在途动作；REQUESTED 且属于本会话时补登记确认动作
 * 5) 属于本会话且通过通知门时通知用户（同一 key 同一类型至多成功一次，投递失败交还通知权）
 * 6) 取消/拒绝/上链请求广播解耦信号（与归属无关，带 notified 标记）
 *
 * 所有步骤都是幂等的：事件与轮询竞争同一条定案时，第二次只会重复失效缓存，
 * 不会重复通知。
 */
@Service
public class EventReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(EventReconciliationEngine.class);

    private final ReservationSession session;
    private final CachedReservationReader reservationReader;
    private final ReservationCacheManager cache;
    private final ReservationEventDecoder decoder;
    private final UserNotifier notifier;
    private final ReservationSignalPublisher signalPublisher;
    private final ReservationSyncProperties props;
    private final ReservationSyncMetrics metrics;
    private final Clock clock;

    public EventReconciliationEngine(ReservationSession session,
                                     CachedReservationReader reservationReader,
                                     ReservationCacheManager cache,
                                     ReservationEventDecoder decoder,
                                     UserNotifier notifier,
                                     ReservationSignalPublisher signalPublisher,
                                     ReservationSyncProperties props,
                                     ReservationSyncMetrics metrics,
                                     Clock clock) {
        this.session = session;
        this.reservationReader = reservationReader;
        this.cache = cache;
        this.decoder = decoder;
        this.notifier = notifier;
        this.signalPublisher = signalPublisher;
        this.props = props;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * 订阅回调入口。单条日志处理失败只记日志，不影响同批其它日志，也不会抛回订阅层。
     */
    public void onLogs(ReservationEventType type, List<LedgerLog> logs) {
        if (logs == null || logs.isEmpty()) {
            return;
        }
        for (LedgerLog entry : logs) {
            metrics.eventReceived(type.name());
            try {
                ReservationEvent event = decoder.decode(type, entry);
                if (event == null) {
                    log.warn("Skip {} log without reservationKey. tx={} args={}",
                            type.getEventName(), entry.getTransactionHash(), entry.getArgs());
                    continue;
                }
                handleEvent(event);
            } catch (Exception e) {
                metrics.eventHandlerError(type.name());
                log.warn("Handle {} log failed. tx={} args={}", type.getEventName(),
                        entry.getTransactionHash(), entry.getArgs(), e);
            }
        }
    }

    public ReconcileResult handleEvent(ReservationEvent event) {
        ValidationUtils.requireNonNull(event, "event");
        return reconcile(event.getType(), event.getReservationKey(), ReconcileContext.fromEvent(event),
                ReconcileSource.EVENT);
    }

    public ReconcileResult reconcile(ReservationEventType type, ReservationKey key,
                                     ReconcileContext context, ReconcileSource source) {
        ValidationUtils.requireNonNull(type, "type");
        ValidationUtils.requireNonNull(key, "reservationKey");
        ReconcileContext ctx = context == null ? ReconcileContext.empty() : context;

        PendingActionTracker pendingActions = session.getPendingActions();
        PendingAction pending = pendingActions.find(key);
        boolean owned = resolveOwnership(key, pending, ctx);
        String tokenId = ctx.getTokenId() != null ? ctx.getTokenId()
                : pending != null ? pending.getTokenId() : null;

        invalidateCaches(key, tokenId, ctx.getRenter(), pending);

        OptimisticUiState optimistic = session.getOptimisticState();
        optimistic.clearOptimisticBookingState(key);

        if (type.isTerminal()) {
            List<PendingAction> resolved = pendingActions.resolve(key);
            if (!resolved.isEmpty()) {
                log.info("Pending action resolved. key={} type={} source={} resolved={}",
                        key, type, source, resolved.size());
            }
        } else if (type == ReservationEventType.REQUESTED && owned && pending == null) {
            String requester = ctx.getRenter() != null ? ctx.getRenter() : session.getIdentity().getAddress();
            pendingActions.register(key, tokenId, requester, PendingActionKind.CONFIRMATION);
        }

        boolean notified = false;
        NotificationDeduper gate = session.getNotificationGate();
        if (owned && gate.tryAcquire(type.getNotificationClass(), key)) {
            try {
                notifier.deliver(buildNotification(type, key, tokenId, ctx.getReason()));
                notified = true;
            } catch (RuntimeException e) {
                // 投递失败交还通知权，重复事件或下一轮轮询可以补发
                gate.release(type.getNotificationClass(), key);
                metrics.notificationFailed(type.name());
                log.warn("Deliver notification failed. type={} key={} source={} err={}",
                        type, key, source, e.toString());
            }
        }

        SignalType signalType = signalTypeOf(type);
        if (signalType != null) {
            signalPublisher.publish(new ReservationSignal(signalType, key.value(), tokenId, notified, ctx.getReason()));
        }

        metrics.reconcile(type.name(), source.name(), owned, notified);
        log.debug("Reconciled. type={} key={} source={} owned={} notified={}", type, key, source, owned, notified);
        return new ReconcileResult(type, key, source, owned, notified);
    }

    private boolean resolveOwnership(ReservationKey key, PendingAction pending, ReconcileContext ctx) {
        if (pending != null) {
            return true;
        }
        SessionIdentity identity = session.getIdentity();
        if (!identity.isKnown()) {
            return false;
        }
        if (ctx.getRenter() != null) {
            return identity.matches(ctx.getRenter());
        }
        if (!props.isOwnershipFallbackRead()) {
            return false;
        }
        try {
            ReservationRecord record = reservationReader.getReservation(key);
            return record != null && record.exists() && identity.matches(record.getRenter());
        } catch (RuntimeException e) {
            // 读不到详情时按不属于本会话处理，宁可漏通知也不误通知
            log.debug("Ownership lookup failed, treat as foreign. key={} err={}", key, e.toString());
            return false;
        }
    }

    private void invalidateCaches(ReservationKey key, String tokenId, String renter, PendingAction pending) {
        cache.invalidateReservation(key);
        if (tokenId != null) {
            cache.invalidateToken(tokenId);
        }
        if (renter != null) {
            cache.invalidateUser(renter);
        }
        if (pending != null && pending.getRequesterAddress() != null
                && !LedgerValues.sameAddress(pending.getRequesterAddress(), renter)) {
            cache.invalidateUser(pending.getRequesterAddress());
        }
        String self = session.getIdentity().getAddress();
        if (self != null && !LedgerValues.sameAddress(self, renter)) {
            cache.invalidateUser(self);
        }
        cache.invalidateSession();
        cache.invalidateBookingLists();
    }

    private UserNotification buildNotification(ReservationEventType type, ReservationKey key, String tokenId,
                                               Integer reason) {
        String lab = tokenId != null ? "Lab " + tokenId : "reservation " + key.value();
        NotificationLevel level;
        String message;
        switch (type) {
            case CONFIRMED:
                level = NotificationLevel.SUCCESS;
                message = "Reservation confirmed for " + lab;
                break;
            case DENIED:
                level = NotificationLevel.ERROR;
                message = "Reservation request denied for " + lab + (reason != null ? " (reason " + reason + ")" : "");
                break;
            case BOOKING_CANCELED:
                level = NotificationLevel.WARNING;
                message = "Booking cancelled for " + lab;
                break;
            case REQUEST_CANCELED:
                level = NotificationLevel.INFO;
                message = "Reservation request cancelled for " + lab;
                break;
            case REQUESTED:
            default:
                level = NotificationLevel.INFO;
                message = "Reservation request registered on-chain for " + lab;
                break;
        }
        Integer carriedReason = type == ReservationEventType.DENIED ? reason : null;
        return new UserNotification(level, type.getNotificationClass(), key.value(), tokenId, message,
                carriedReason, clock.instant());
    }

    private static SignalType signalTypeOf(ReservationEventType type) {
        switch (type) {
            case BOOKING_CANCELED:
            case REQUEST_CANCELED:
                return SignalType.RESERVATION_CANCELLED;
            case DENIED:
                return SignalType.RESERVATION_REQUEST_DENIED;
            case REQUESTED:
                return SignalType.RESERVATION_REQUESTED_ONCHAIN;
            default:
                return null;
        }
    }
}
