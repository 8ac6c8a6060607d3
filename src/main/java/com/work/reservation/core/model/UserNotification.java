package com.work.reservation.core.model;

import java.time.Instant;

/**
 * 面向用户的通知。
 */
public class UserNotification {

    private final NotificationLevel level;
    private final NotificationClass notificationClass;
    private final String reservationKey;
    private final String tokenId;
    private final String message;
    private final Integer reason;
    private final Instant createdAt;

    public UserNotification(NotificationLevel level, NotificationClass notificationClass, String reservationKey,
                            String tokenId, String message, Integer reason, Instant createdAt) {
        this.level = level;
        this.notificationClass = notificationClass;
        this.reservationKey = reservationKey;
        this.tokenId = tokenId;
        this.message = message;
        this.reason = reason;
        this.createdAt = createdAt;
    }

    public NotificationLevel getLevel() {
        return level;
    }

    public NotificationClass getNotificationClass() {
        return notificationClass;
    }

    public String getReservationKey() {
        return reservationKey;
    }

    public String getTokenId() {
        return tokenId;
    }

    public String getMessage() {
        return message;
    }

    public Integer getReason() {
        return reason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
