package com.work.reservation.core.model;

import com.work.reservation.core.support.LedgerValues;

/**
 * getReservation(key) 的读结果。renter 为零地址表示链上不存在该预约。
 */
public class ReservationRecord {

    private final ReservationKey reservationKey;
    private final String tokenId;
    private final String renter;
    private final String price;
    private final Long start;
    private final Long end;
    private final int statusCode;

    public ReservationRecord(ReservationKey reservationKey, String tokenId, String renter,
                             String price, Long start, Long end, int statusCode) {
        this.reservationKey = reservationKey;
        this.tokenId = tokenId;
        this.renter = LedgerValues.address(renter);
        this.price = price;
        this.start = start;
        this.end = end;
        this.statusCode = statusCode;
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

    public String getPrice() {
        return price;
    }

    public Long getStart() {
        return start;
    }

    public Long getEnd() {
        return end;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public ReservationStatus getStatus() {
        return ReservationStatus.fromCode(statusCode);
    }

    public boolean exists() {
        return !LedgerValues.isZeroAddress(renter);
    }
}
