package com.work.reservation.core.model;

public enum NotificationLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
