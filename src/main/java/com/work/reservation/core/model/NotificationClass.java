package com.work.reservation.core.model;

/**
 * 去重门的事件类别：同一个 (类别, reservationKey) 在一次会话内最多通知一次。
 */
public enum NotificationClass {
    REQUESTED,
    CONFIRMED,
    DENIED,
    CANCELED
}
