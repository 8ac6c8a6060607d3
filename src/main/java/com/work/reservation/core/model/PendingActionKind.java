package com.work.reservation.core.model;

public enum PendingActionKind {
    /**
     * 已提交预约请求，等待确认/拒绝
     */
    CONFIRMATION,
    /**
     * 已提交取消，等待链上取消落地
     */
    CANCELLATION
}
