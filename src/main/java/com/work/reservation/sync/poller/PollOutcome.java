package com.work.reservation.sync.poller;

/**
 * 单条在途动作一次检查的结果。
 */
public enum PollOutcome {
    /** 超时淘汰 */
    EVICTED,
    /** 按 attempts 退避，本轮跳过 */
    THROTTLED,
    /** 查询失败，attempts+1 */
    LOOKUP_FAILED,
    /** 查询期间已被事件定案 */
    ALREADY_RESOLVED,
    NOT_FOUND,
    STILL_PENDING,
    REQUEST_RECOVERED,
    CONFIRMED,
    DENIED,
    CANCELLED,
    /** 本轮等待截止时仍未返回 */
    IN_FLIGHT,
    FAILED
}
