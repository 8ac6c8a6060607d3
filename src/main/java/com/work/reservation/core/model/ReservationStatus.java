package com.work.reservation.core.model;

/**
 * 合约中的预约状态码。
 *
 * 0=PENDING（已请求，待 provider 确认）、1=BOOKED、2=USED、3=COLLECTED、4=CANCELLED。
 * 其他未知码一律按终态（拒绝）处理。
 */
public enum ReservationStatus {
    PENDING(0),
    BOOKED(1),
    USED(2),
    COLLECTED(3),
    CANCELLED(4),
    UNKNOWN(-1);

    private final int code;

    ReservationStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static ReservationStatus fromCode(int code) {
        for (ReservationStatus s : values()) {
            if (s.code == code && s != UNKNOWN) {
                return s;
            }
        }
        return UNKNOWN;
    }

    public boolean isPending() {
        return this == PENDING;
    }

    /**
     * 已被确认（含已使用、已结算）。
     */
    public boolean isConfirmed() {
        return this == BOOKED || this == USED || this == COLLECTED;
    }

    /**
     * 终态且未确认：被拒绝、被取消或未知码。
     */
    public boolean isTerminalDenied() {
        return this == CANCELLED || this == UNKNOWN;
    }
}
