package com.work.reservation.core.model;

/**
 * 已解码、已规范化的合约事件。
 */
public class ReservationEvent {

    private final ReservationEventType type;
    private final ReservationKey reservationKey;
    private final String tokenId;
    private final String renter;
    private final Long start;
    private final Long end;
    private final Integer reason;

    public ReservationEvent(ReservationEventType type, ReservationKey reservationKey, String tokenId,
                            String renter, Long start, Long end, Integer reason) {
        this.type = type;
        this.reservationKey = reservationKey;
        this.tokenId = tokenId;
        this.renter = renter;
        this.start = start;
        this.end = end;
        this.reason = reason;
    }

    public ReservationEventType getType() {
        return type;
    }

    public ReservationKey getReservationKey() {
        return reservationKey;
    }

    public String getTokenId() {
        return tokenId;
    }

    public String getRenter() {
        return renter;
    }

    public Long getStart() {
        return start;
    }

    public Long getEnd() {
        return end;
    }

    public Integer getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "ReservationEvent{" + type + ", key=" + reservationKey + ", tokenId=" + tokenId
                + ", renter=" + renter + (reason == null ? "" : ", reason=" + reason) + '}';
    }
}
