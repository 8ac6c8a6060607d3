package com.work.reservation.core.exception;

/**
 * 组件内部的统一异常类型，便于调用方捕获或转换为接口错误码。
 */
public class ReservationSyncException extends RuntimeException {

    public ReservationSyncException(String message) {
        super(message);
    }

    public ReservationSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
