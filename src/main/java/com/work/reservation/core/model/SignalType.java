package com.work.reservation.core.model;

/**
 * 对外广播的解耦信号。
 */
public enum SignalType {
    RESERVATION_CANCELLED("reservation-cancelled"),
    RESERVATION_REQUEST_DENIED("reservation-request-denied"),
    RESERVATION_REQUESTED_ONCHAIN("reservation-requested-onchain");

    private final String wireName;

    SignalType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
