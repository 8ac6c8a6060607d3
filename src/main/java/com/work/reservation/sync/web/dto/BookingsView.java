package com.work.reservation.sync.web.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class BookingsView {

    private List<Map<String, Object>> allBookings;
    private List<Map<String, Object>> userBookings;
    private boolean usingCache;
    private boolean hasError;
    private int consecutiveAttempts;
    private Instant lastFetchAt;
    private Instant nextRetryAt;

    public List<Map<String, Object>> getAllBookings() {
        return allBookings;
    }

    public void setAllBookings(List<Map<String, Object>> allBookings) {
        this.allBookings = allBookings;
    }

    public List<Map<String, Object>> getUserBookings() {
        return userBookings;
    }

    public void setUserBookings(List<Map<String, Object>> userBookings) {
        this.userBookings = userBookings;
    }

    public boolean isUsingCache() {
        return usingCache;
    }

    public void setUsingCache(boolean usingCache) {
        this.usingCache = usingCache;
    }

    public boolean isHasError() {
        return hasError;
    }

    public void setHasError(boolean hasError) {
        this.hasError = hasError;
    }

    public int getConsecutiveAttempts() {
        return consecutiveAttempts;
    }

    public void setConsecutiveAttempts(int consecutiveAttempts) {
        this.consecutiveAttempts = consecutiveAttempts;
    }

    public Instant getLastFetchAt() {
        return lastFetchAt;
    }

    public void setLastFetchAt(Instant lastFetchAt) {
        this.lastFetchAt = lastFetchAt;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }

    public void setNextRetryAt(Instant nextRetryAt) {
        this.nextRetryAt = nextRetryAt;
    }
}
