package com.work.reservation.core.fetch;

import java.time.Duration;
import java.time.Instant;

/**
 * 批量刷新准入判定结果。
 */
public class FetchDecision {

    public enum Verdict {
        PROCEED,
        /**
         * 距上次刷新不足 minInterval（非强制）
         */
        DEBOUNCED,
        /**
         * 连续失败达到上限，nextRetryAt 之前拒绝一切请求（含强制）
         */
        RATE_LIMITED
    }

    private final Verdict verdict;
    private final Duration wait;
    private final Instant nextRetryAt;

    private FetchDecision(Verdict verdict, Duration wait, Instant nextRetryAt) {
        this.verdict = verdict;
        this.wait = wait;
        this.nextRetryAt = nextRetryAt;
    }

    public static FetchDecision proceed() {
        return new FetchDecision(Verdict.PROCEED, Duration.ZERO, null);
    }

    public static FetchDecision debounced(Duration remaining) {
        return new FetchDecision(Verdict.DEBOUNCED, remaining, null);
    }

    public static FetchDecision rateLimited(Duration remaining, Instant nextRetryAt) {
        return new FetchDecision(Verdict.RATE_LIMITED, remaining, nextRetryAt);
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isAllowed() {
        return verdict == Verdict.PROCEED;
    }

    public Duration getWait() {
        return wait;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }
}
