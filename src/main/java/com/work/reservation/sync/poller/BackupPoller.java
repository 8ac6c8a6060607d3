package com.work.reservation.sync.poller;

import com.work.reservation.core.ledger.LedgerReader;
import com.work.reservation.core.model.NotificationClass;
import com.work.reservation.core.model.PendingAction;
import com.work.reservation.core.model.PendingActionKind;
import com.work.reservation.core.model.ReservationEventType;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.core.model.ReservationStatus;
import com.work.reservation.core.pending.PendingActionTracker;
import com.work.reservation.core.session.ReservationSession;
import com.work.reservation.core.support.ValidationUtils;
import com.work.reservation.sync.config.ReservationSyncProperties;
import com.work.reservation.sync.reconcile.EventReconciliationEngine;
import com.work.reservation.sync.reconcile.ReconcileContext;
import com.work.reservation.sync.reconcile.ReconcileSource;
import com.work.reservation.sync.support.metrics.ReservationSyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 兜底轮询：事件订阅丢事件时，按周期读链上详情把在途动作定案。
 *
 * 每轮对全部在途动作并发检查，单条失败/变慢不影响其它条目；
 * 定案统一交给 {@link EventReconciliationEngine}，与事件路径共享通知门，保证只通知一次。
 */
@Component
@ConditionalOnProperty(prefix = "reservation-sync", name = "backup-polling-enabled", havingValue = "true")
public class BackupPoller {

    private static final Logger log = LoggerFactory.getLogger(BackupPoller.class);

    private final ReservationSyncProperties props;
    private final ReservationSession session;
    private final LedgerReader ledgerReader;
    private final EventReconciliationEngine engine;
    private final ReservationSyncMetrics metrics;
    private final Clock clock;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BackupPoller(ReservationSyncProperties props,
                        ReservationSession session,
                        LedgerReader ledgerReader,
                        EventReconciliationEngine engine,
                        ReservationSyncMetrics metrics,
                        Clock clock) {
        this.props = props;
        this.session = session;
        this.ledgerReader = ledgerReader;
        this.engine = engine;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        ValidationUtils.requirePositive(props.getPollInterval(), "pollInterval");
        ValidationUtils.requirePositive(props.getPendingActionTimeout(), "pendingActionTimeout");
        int workers = Math.max(1, props.getPollWorkers());
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("backup-poll-worker-" + t.getId());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(workers, tf);
        log.info("Backup polling enabled. interval={} timeout={} workers={}",
                props.getPollInterval(), props.getPendingActionTimeout(), workers);
    }

    @PreDestroy
    public void destroy() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Scheduled(fixedDelayString = "#{@reservationSyncProperties.pollInterval.toMillis()}")
    public void scheduledPoll() {
        pollOnce();
    }

    /**
     * 执行一轮检查，返回每条在途动作的结果；上一轮仍在执行时直接返回空列表。
     */
    public List<PollOutcome> pollOnce() {
        if (!running.compareAndSet(false, true)) {
            return Collections.emptyList();
        }
        try {
            List<PendingAction> actions = session.getPendingActions().snapshot();
            if (actions.isEmpty()) {
                return Collections.emptyList();
            }
            Instant now = clock.instant();
            List<CompletableFuture<PollOutcome>> futures = new ArrayList<>(actions.size());
            for (PendingAction action : actions) {
                futures.add(CompletableFuture.supplyAsync(() -> check(action, now), executor)
                        .exceptionally(e -> {
                            log.warn("Backup poll check failed. key={} kind={} err={}",
                                    action.getReservationKey(), action.getKind(), e.toString());
                            return PollOutcome.FAILED;
                        }));
            }
            awaitAll(futures);

            List<PollOutcome> outcomes = new ArrayList<>(futures.size());
            for (CompletableFuture<PollOutcome> f : futures) {
                PollOutcome outcome = f.getNow(PollOutcome.IN_FLIGHT);
                outcomes.add(outcome);
                metrics.pollCheck(outcome.name());
            }
            return outcomes;
        } finally {
            running.set(false);
        }
    }

    private void awaitAll(List<CompletableFuture<PollOutcome>> futures) {
        long waitMillis = Math.max(1L, props.getPollInterval().toMillis());
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Backup poll round exceeded {}ms, slow lookups continue in background", waitMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            // exceptionally() 已兜底，这里不会出现
            log.warn("Backup poll round failed. err={}", e.toString());
        }
    }

    PollOutcome check(PendingAction action, Instant now) {
        PendingActionTracker tracker = session.getPendingActions();
        ReservationKey key = action.getReservationKey();
        PendingActionKind kind = action.getKind();

        if (tracker.isExpired(action, props.getPendingActionTimeout(), now)) {
            tracker.remove(key, kind);
            log.info("Pending action timed out, stop tracking. key={} kind={} attempts={}",
                    key, kind, action.getAttempts());
            return PollOutcome.EVICTED;
        }

        Duration age = Duration.between(action.getCreatedAt(), now);
        if (props.getPollInterval().multipliedBy(action.getAttempts()).compareTo(age) > 0) {
            return PollOutcome.THROTTLED;
        }

        ReservationRecord record;
        try {
            record = ledgerReader.getReservation(key);
        } catch (Exception e) {
            int attempts = tracker.recordFailedAttempt(key, kind);
            log.warn("Backup poll lookup failed. key={} kind={} attempts={} err={}", key, kind, attempts, e.toString());
            return PollOutcome.LOOKUP_FAILED;
        }

        // 查询期间事件可能已经定案
        if (!tracker.isTracked(key, kind)) {
            return PollOutcome.ALREADY_RESOLVED;
        }
        if (record == null || !record.exists()) {
            return PollOutcome.NOT_FOUND;
        }

        ReconcileContext ctx = ReconcileContext.fromRecord(record, action);
        ReservationStatus status = record.getStatus();
        if (kind == PendingActionKind.CANCELLATION) {
            if (status.isTerminalDenied()) {
                engine.reconcile(ReservationEventType.BOOKING_CANCELED, key, ctx, ReconcileSource.POLL);
                return PollOutcome.CANCELLED;
            }
            return PollOutcome.STILL_PENDING;
        }

        if (status.isTerminalDenied()) {
            engine.reconcile(ReservationEventType.DENIED, key, ctx, ReconcileSource.POLL);
            return PollOutcome.DENIED;
        }
        if (status.isConfirmed()) {
            engine.reconcile(ReservationEventType.CONFIRMED, key, ctx, ReconcileSource.POLL);
            return PollOutcome.CONFIRMED;
        }
        if (status.isPending()
                && !session.getNotificationGate().hasNotified(NotificationClass.REQUESTED, key)) {
            engine.reconcile(ReservationEventType.REQUESTED, key, ctx, ReconcileSource.POLL);
            return PollOutcome.REQUEST_RECOVERED;
        }
        return PollOutcome.STILL_PENDING;
    }
}
