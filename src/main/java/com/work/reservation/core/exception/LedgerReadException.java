package com.work.reservation.core.exception;

/**
 * 链上读操作失败（RPC 超时、连接错误、节点异常等），属于瞬时错误：
 * 轮询路径会在超时前持续重试，不直接暴露给用户。
 */
public class LedgerReadException extends ReservationSyncException {

    public LedgerReadException(String message) {
        super(message);
    }

    public LedgerReadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    /**
     * 是否为上游限流（HTTP 429 / "rate limit" 一类）。
     */
    public boolean isRateLimited() {
        return false;
    }
}
