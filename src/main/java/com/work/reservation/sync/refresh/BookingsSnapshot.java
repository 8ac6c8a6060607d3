package com.work.reservation.sync.refresh;

import com.work.reservation.core.model.ReservationRecord;

import java.time.Instant;
import java.util.List;

/**
 * 批量刷新对外暴露的只读视图。
 */
public class BookingsSnapshot {

    private final List<ReservationRecord> allBookings;
    private final List<ReservationRecord> userBookings;
    /** 本次调用是否真正发起了读取（缓存或链上） */
    private final boolean fetched;
    private final boolean usingCache;
    private final boolean hasError;
    private final int consecutiveAttempts;
    private final Instant lastFetchAt;
    private final Instant nextRetryAt;

    public BookingsSnapshot(List<ReservationRecord> allBookings, List<ReservationRecord> userBookings,
                            boolean fetched, boolean usingCache, boolean hasError,
                            int consecutiveAttempts, Instant lastFetchAt, Instant nextRetryAt) {
        this.allBookings = List.copyOf(allBookings);
        this.userBookings = List.copyOf(userBookings);
        this.fetched = fetched;
        this.usingCache = usingCache;
        this.hasError = hasError;
        this.consecutiveAttempts = consecutiveAttempts;
        this.lastFetchAt = lastFetchAt;
        this.nextRetryAt = nextRetryAt;
    }

    public List<ReservationRecord> getAllBookings() {
        return allBookings;
    }

    public List<ReservationRecord> getUserBookings() {
        return userBookings;
    }

    public boolean isFetched() {
        return fetched;
    }

    public boolean isUsingCache() {
        return usingCache;
    }

    public boolean isHasError() {
        return hasError;
    }

    public int getConsecutiveAttempts() {
        return consecutiveAttempts;
    }

    public Instant getLastFetchAt() {
        return lastFetchAt;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }
}
