package com.work.reservation.sync.reconcile;

import com.work.reservation.core.model.ReservationEventType;
import com.work.reservation.core.model.ReservationKey;

public class ReconcileResult {

    private final ReservationEventType type;
    private final ReservationKey reservationKey;
    private final ReconcileSource source;
    private final boolean owned;
    private final boolean notified;

    public ReconcileResult(ReservationEventType type, ReservationKey reservationKey, ReconcileSource source,
                           boolean owned, boolean notified) {
        this.type = type;
        this.reservationKey = reservationKey;
        this.source = source;
        this.owned = owned;
        this.notified = notified;
    }

    public ReservationEventType getType() {
        return type;
    }

    public ReservationKey getReservationKey() {
        return reservationKey;
    }

    public ReconcileSource getSource() {
        return source;
    }

    public boolean isOwned() {
        return owned;
    }

    public boolean isNotified() {
        return notified;
    }

    @Override
    public String toString() {
        return "ReconcileResult{" + type + ", key=" + reservationKey + ", source=" + source
                + ", owned=" + owned + ", notified=" + notified + '}';
    }
}
