package com.work.reservation.core.model;

import java.time.Instant;

/**
 * 本会话发起、尚未在链上定案的预约动作。
 *
 * requesterAddress 是提交时带完整会话上下文采集的地址，判定归属时优先于事件里的 renter。
 */
public class PendingAction {

    private final ReservationKey reservationKey;
    private final String tokenId;
    private final String requesterAddress;
    private final PendingActionKind kind;
    private final Instant createdAt;
    private final int attempts;

    public PendingAction(ReservationKey reservationKey, String tokenId, String requesterAddress,
                         PendingActionKind kind, Instant createdAt, int attempts) {
        this.reservationKey = reservationKey;
        this.tokenId = tokenId;
        this.requesterAddress = requesterAddress;
        this.kind = kind;
        this.createdAt = createdAt;
        this.attempts = attempts;
    }

    public ReservationKey getReservationKey() {
        return reservationKey;
    }

    public String getTokenId() {
        return tokenId;
    }

    public String getRequesterAddress() {
        return requesterAddress;
    }

    public PendingActionKind getKind() {
        return kind;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getAttempts() {
        return attempts;
    }

    public PendingAction withAttempts(int newAttempts) {
        return new PendingAction(reservationKey, tokenId, requesterAddress, kind, createdAt, newAttempts);
    }

    @Override
    public String toString() {
        return "PendingAction{" + kind + ", key=" + reservationKey + ", tokenId=" + tokenId
                + ", requester=" + requesterAddress + ", createdAt=" + createdAt + ", attempts=" + attempts + '}';
    }
}
