package com.work.reservation.core.model;

/**
 * 合约事件类型。
 */
public enum ReservationEventType {
    REQUESTED("ReservationRequested", NotificationClass.REQUESTED, false),
    CONFIRMED("ReservationConfirmed", NotificationClass.CONFIRMED, true),
    BOOKING_CANCELED("BookingCanceled", NotificationClass.CANCELED, true),
    REQUEST_CANCELED("ReservationRequestCanceled", NotificationClass.CANCELED, true),
    DENIED("ReservationRequestDenied", NotificationClass.DENIED, true);

    private final String eventName;
    private final NotificationClass notificationClass;
    private final boolean terminal;

    ReservationEventType(String eventName, NotificationClass notificationClass, boolean terminal) {
        this.eventName = eventName;
        this.notificationClass = notificationClass;
        this.terminal = terminal;
    }

    public String getEventName() {
        return eventName;
    }

    public NotificationClass getNotificationClass() {
        return notificationClass;
    }

    /**
     * 终态事件会结束 pending action 的跟踪。
     */
    public boolean isTerminal() {
        return terminal;
    }
}
