package com.work.reservation.core.fetch;

import com.work.reservation.core.model.FetchState;

import java.time.Duration;
import java.time.Instant;

/**
 * 批量预约列表刷新的节奏控制（纯策略，不做 IO）。
 *
 * - 最小间隔：从未成功 10s（失败>3 次后 30s）；成功过 60s（失败>2 次后 120s）
 * - 连续失败达到上限（成功过 3 次，否则 5 次）后进入限流：按 5s/15s/30s/60s/120s 递增等待，
 *   等待期内拒绝所有请求，包括强制刷新
 * - 上游限流类失败在计数较低时不累加，避免客户端节流叠加上游节流
 */
public class BackoffFetchScheduler {

    static final Duration[] RATE_LIMITED_DELAYS = {
            Duration.ofSeconds(5),
            Duration.ofSeconds(15),
            Duration.ofSeconds(30),
            Duration.ofSeconds(60),
            Duration.ofSeconds(120)
    };

    /**
     * 限流失败在 attempts 小于该值时不计数
     */
    static final int RATE_LIMIT_FREE_PASSES = 2;

    public Duration minInterval(boolean hasEverSucceeded, int consecutiveAttempts) {
        if (!hasEverSucceeded) {
            return consecutiveAttempts > 3 ? Duration.ofSeconds(30) : Duration.ofSeconds(10);
        }
        return consecutiveAttempts > 2 ? Duration.ofSeconds(120) : Duration.ofSeconds(60);
    }

    public int attemptCeiling(boolean hasEverSucceeded) {
        return hasEverSucceeded ? 3 : 5;
    }

    public Duration rateLimitedDelay(int attemptsBeyondCeiling) {
        int idx = Math.min(Math.max(0, attemptsBeyondCeiling), RATE_LIMITED_DELAYS.length - 1);
        return RATE_LIMITED_DELAYS[idx];
    }

    public FetchDecision evaluate(FetchState state, boolean force, Instant now) {
        Instant last = state.getLastFetchAt();
        if (last == null) {
            return FetchDecision.proceed();
        }
        Duration elapsed = Duration.between(last, now);

        if (!force) {
            Duration min = minInterval(state.isHasEverSucceeded(), state.getConsecutiveAttempts());
            if (elapsed.compareTo(min) < 0) {
                return FetchDecision.debounced(min.minus(elapsed));
            }
        }

        int ceiling = attemptCeiling(state.isHasEverSucceeded());
        if (state.getConsecutiveAttempts() >= ceiling) {
            Duration delay = rateLimitedDelay(state.getConsecutiveAttempts() - ceiling);
            Instant nextRetryAt = last.plus(delay);
            if (now.isBefore(nextRetryAt)) {
                return FetchDecision.rateLimited(Duration.between(now, nextRetryAt), nextRetryAt);
            }
        }
        return FetchDecision.proceed();
    }

    public void onAttempt(FetchState state, Instant now) {
        state.setLastFetchAt(now);
        state.setNextRetryAt(null);
    }

    public void onSuccess(FetchState state) {
        state.setConsecutiveAttempts(0);
        state.setHasEverSucceeded(true);
        state.setNextRetryAt(null);
    }

    /**
     * @return 失败后的 consecutiveAttempts
     */
    public int onFailure(FetchState state, boolean rateLimited) {
        int attempts = state.getConsecutiveAttempts();
        if (!(rateLimited && attempts < RATE_LIMIT_FREE_PASSES)) {
            attempts++;
        }
        state.setConsecutiveAttempts(attempts);
        return attempts;
    }

    /**
     * 失败后单次重试的延迟：限流类 5s 起每次 +2s，封顶 15s；普通失败走递增表。
     */
    public Duration retryDelayAfterFailure(int attempts, boolean rateLimited) {
        if (rateLimited) {
            return Duration.ofMillis(Math.min(5000L + attempts * 2000L, 15000L));
        }
        return rateLimitedDelay(Math.max(0, attempts - 1));
    }

    /**
     * 自动重试的次数上限：成功过 5 次，否则 8 次。
     */
    public int maxScheduledRetries(boolean hasEverSucceeded) {
        return hasEverSucceeded ? 5 : 8;
    }
}
