package com.work.reservation.core.model;

/**
 * 解耦信号载荷：监听方不需要依赖对账引擎即可感知取消/拒绝/链上请求。
 * notified 表示本次对账是否已经给用户发过通知。
 */
public class ReservationSignal {

    private final SignalType type;
    private final String reservationKey;
    private final String tokenId;
    private final boolean notified;
    private final Integer reason;

    public ReservationSignal(SignalType type, String reservationKey, String tokenId, boolean notified, Integer reason) {
        this.type = type;
        this.reservationKey = reservationKey;
        this.tokenId = tokenId;
        this.notified = notified;
        this.reason = reason;
    }

    public SignalType getType() {
        return type;
    }

    public String getReservationKey() {
        return reservationKey;
    }

    public String getTokenId() {
        return tokenId;
    }

    public boolean isNotified() {
        return notified;
    }

    public Integer getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return type.getWireName() + "{reservationKey=" + reservationKey + ", tokenId=" + tokenId
                + ", notified=" + notified + (reason == null ? "" : ", reason=" + reason) + '}';
    }
}
