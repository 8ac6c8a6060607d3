package com.work.reservation.sync.refresh;

import com.work.reservation.core.cache.CacheKeys;
import com.work.reservation.core.cache.ReservationCacheManager;
import com.work.reservation.core.exception.LedgerRateLimitedException;
import com.work.reservation.core.fetch.BackoffFetchScheduler;
import com.work.reservation.core.fetch.FetchDecision;
import com.work.reservation.core.ledger.LedgerReader;
import com.work.reservation.core.model.FetchState;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.core.session.SessionIdentity;
import com.work.reservation.core.support.LedgerValues;
import com.work.reservation.sync.config.ReservationSyncProperties;
import com.work.reservation.sync.support.metrics.ReservationSyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 全量预约列表的节流刷新。
 *
 * - 非强制请求在最小间隔内直接返回上次结果（不读链）
 * - 连续失败超过阈值进入限流模式，强制请求也拒绝
 * - 失败时优先回退到缓存旧值，已有数据绝不回退成空列表
 * - 失败后至多挂一个单次重试，成功或销毁时取消
 */
@Service
public class ReservationListRefresher {

    private static final Logger log = LoggerFactory.getLogger(ReservationListRefresher.class);

    private final LedgerReader ledgerReader;
    private final ReservationCacheManager cache;
    private final BackoffFetchScheduler scheduler;
    private final SessionIdentity identity;
    private final ReservationSyncProperties props;
    private final ReservationSyncMetrics metrics;
    private final Clock clock;

    private final FetchState state = new FetchState();
    private List<ReservationRecord> allBookings = Collections.emptyList();
    private boolean usingCache;
    private boolean hasError;
    private int scheduledRetries;
    private ScheduledExecutorService retryExecutor;
    private ScheduledFuture<?> pendingRetry;

    public ReservationListRefresher(LedgerReader ledgerReader,
                                    ReservationCacheManager cache,
                                    BackoffFetchScheduler scheduler,
                                    SessionIdentity identity,
                                    ReservationSyncProperties props,
                                    ReservationSyncMetrics metrics,
                                    Clock clock) {
        this.ledgerReader = ledgerReader;
        this.cache = cache;
        this.scheduler = scheduler;
        this.identity = identity;
        this.props = props;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        this.retryExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("bookings-refresh-retry");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public synchronized void destroy() {
        cancelPendingRetry();
        if (retryExecutor != null) {
            retryExecutor.shutdownNow();
        }
    }

    public BookingsSnapshot fetchBookings(boolean force) {
        return fetch(force, false);
    }

    /**
     * 手动刷新：跳过最小间隔与新鲜缓存，但仍受限流模式约束。
     */
    public BookingsSnapshot refresh() {
        return fetch(true, false);
    }

    /**
     * 取消尚未执行的自动重试（例如会话切换时）。
     */
    public synchronized void cancelScheduledRetry() {
        cancelPendingRetry();
        scheduledRetries = 0;
    }

    public synchronized BookingsSnapshot snapshot() {
        return snapshot(false);
    }

    private synchronized BookingsSnapshot fetch(boolean force, boolean scheduledRetry) {
        FetchDecision decision = scheduler.evaluate(state, force || scheduledRetry, clock.instant());
        switch (decision.getVerdict()) {
            case DEBOUNCED:
                log.debug("Bookings fetch debounced, wait {}ms", decision.getWait().toMillis());
                metrics.bulkRefresh("debounced");
                return snapshot(false);
            case RATE_LIMITED:
                state.setNextRetryAt(decision.getNextRetryAt());
                log.info("Bookings fetch refused in rate-limited mode. attempts={} nextRetryAt={}",
                        state.getConsecutiveAttempts(), decision.getNextRetryAt());
                metrics.bulkRefresh("rate_limited");
                return snapshot(false);
            default:
                break;
        }

        if (!force) {
            // 命中新鲜缓存不算一次读链：不更新 lastFetchAt，也不清零连续失败计数
            Optional<List<ReservationRecord>> cached =
                    cache.getList(CacheKeys.ALL_BOOKINGS, ReservationRecord.class, false);
            if (cached.isPresent()) {
                allBookings = cached.get();
                usingCache = true;
                metrics.bulkRefresh("cache");
                return snapshot(true);
            }
        }

        scheduler.onAttempt(state, clock.instant());
        try {
            List<ReservationRecord> loaded = ledgerReader.listReservations();
            List<ReservationRecord> data = loaded == null ? Collections.emptyList() : List.copyOf(loaded);
            cache.put(CacheKeys.ALL_BOOKINGS, data, props.getCache().getBookingsTtl());
            allBookings = data;
            cacheUserBookings(data);
            scheduler.onSuccess(state);
            usingCache = false;
            hasError = false;
            scheduledRetries = 0;
            cancelPendingRetry();
            metrics.bulkRefresh("ledger");
            return snapshot(true);
        } catch (RuntimeException e) {
            return onFailure(e);
        }
    }

    private BookingsSnapshot onFailure(RuntimeException e) {
        boolean rateLimited = LedgerRateLimitedException.looksRateLimited(e);
        int attempts = scheduler.onFailure(state, rateLimited);
        hasError = true;
        metrics.bulkRefresh(rateLimited ? "error_rate_limited" : "error");

        Optional<List<ReservationRecord>> stale =
                cache.getList(CacheKeys.ALL_BOOKINGS, ReservationRecord.class, true);
        if (stale.isPresent()) {
            allBookings = stale.get();
            usingCache = true;
            log.warn("Bookings fetch failed, serving stale cache. attempts={} rateLimited={} err={}",
                    attempts, rateLimited, e.toString());
        } else {
            log.warn("Bookings fetch failed, keep last known data ({} rows). attempts={} rateLimited={} err={}",
                    allBookings.size(), attempts, rateLimited, e.toString());
        }
        scheduleRetry(attempts, rateLimited);
        return snapshot(true);
    }

    private void scheduleRetry(int attempts, boolean rateLimited) {
        if (retryExecutor == null || pendingRetry != null) {
            return;
        }
        if (scheduledRetries >= scheduler.maxScheduledRetries(state.isHasEverSucceeded())) {
            log.warn("Bookings auto retry exhausted after {} retries", scheduledRetries);
            return;
        }
        scheduledRetries++;
        Duration delay = scheduler.retryDelayAfterFailure(attempts, rateLimited);
        state.setNextRetryAt(clock.instant().plus(delay));
        pendingRetry = retryExecutor.schedule(this::runScheduledRetry, delay.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Bookings retry scheduled in {}ms ({}/{})", delay.toMillis(), scheduledRetries,
                scheduler.maxScheduledRetries(state.isHasEverSucceeded()));
    }

    private void runScheduledRetry() {
        synchronized (this) {
            pendingRetry = null;
        }
        try {
            fetch(false, true);
        } catch (Exception e) {
            log.warn("Bookings scheduled retry failed. err={}", e.toString());
        }
    }

    private void cancelPendingRetry() {
        if (pendingRetry != null) {
            pendingRetry.cancel(false);
            pendingRetry = null;
        }
    }

    private void cacheUserBookings(List<ReservationRecord> data) {
        String self = identity.getAddress();
        if (self == null) {
            return;
        }
        cache.put(CacheKeys.userBookings(self), filterUser(data, self), props.getCache().getBookingsTtl());
    }

    private List<ReservationRecord> userBookings() {
        String self = identity.getAddress();
        if (self == null) {
            return Collections.emptyList();
        }
        if (usingCache) {
            Optional<List<ReservationRecord>> cached =
                    cache.getList(CacheKeys.userBookings(self), ReservationRecord.class, true);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        return filterUser(allBookings, self);
    }

    private static List<ReservationRecord> filterUser(List<ReservationRecord> data, String address) {
        List<ReservationRecord> out = new ArrayList<>();
        for (ReservationRecord r : data) {
            if (LedgerValues.sameAddress(address, r.getRenter())) {
                out.add(r);
            }
        }
        return out;
    }

    private BookingsSnapshot snapshot(boolean fetched) {
        return new BookingsSnapshot(allBookings, userBookings(), fetched, usingCache, hasError,
                state.getConsecutiveAttempts(), state.getLastFetchAt(), state.getNextRetryAt());
    }
}
