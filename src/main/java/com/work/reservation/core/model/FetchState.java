package com.work.reservation.core.model;

import java.time.Instant;

/**
 * 批量刷新节奏状态：成功后 consecutiveAttempts 归零，失败递增（限流有少量豁免）。
 */
public class FetchState {

    private Instant lastFetchAt;
    private int consecutiveAttempts;
    private boolean hasEverSucceeded;
    private Instant nextRetryAt;

    public Instant getLastFetchAt() {
        return lastFetchAt;
    }

    public void setLastFetchAt(Instant lastFetchAt) {
        this.lastFetchAt = lastFetchAt;
    }

    public int getConsecutiveAttempts() {
        return consecutiveAttempts;
    }

    public void setConsecutiveAttempts(int consecutiveAttempts) {
        this.consecutiveAttempts = consecutiveAttempts;
    }

    public boolean isHasEverSucceeded() {
        return hasEverSucceeded;
    }

    public void setHasEverSucceeded(boolean hasEverSucceeded) {
        this.hasEverSucceeded = hasEverSucceeded;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }

    public void setNextRetryAt(Instant nextRetryAt) {
        this.nextRetryAt = nextRetryAt;
    }
}
