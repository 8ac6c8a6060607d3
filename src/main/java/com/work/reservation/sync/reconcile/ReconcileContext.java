package com.work.reservation.sync.reconcile;

import com.work.reservation.core.model.PendingAction;
import com.work.reservation.core.model.ReservationEvent;
import com.work.reservation.core.model.ReservationRecord;

/**
 * 对账时可用的附带信息。字段均可能为空。
 */
public class ReconcileContext {

    private final String tokenId;
    private final String renter;
    private final Integer reason;

    public ReconcileContext(String tokenId, String renter, Integer reason) {
        this.tokenId = tokenId;
        this.renter = renter;
        this.reason = reason;
    }

    public static ReconcileContext empty() {
        return new ReconcileContext(null, null, null);
    }

    public static ReconcileContext fromEvent(ReservationEvent event) {
        return new ReconcileContext(event.getTokenId(), event.getRenter(), event.getReason());
    }

    /**
     * 轮询读到的链上详情；tokenId 缺失时回退到在途动作里记录的值。
     */
    public static ReconcileContext fromRecord(ReservationRecord record, PendingAction action) {
        String token = record.getTokenId();
        if (token == null && action != null) {
            token = action.getTokenId();
        }
        return new ReconcileContext(token, record.getRenter(), null);
    }

    public String getTokenId() {
        return tokenId;
    }

    public String getRenter() {
        return renter;
    }

    public Integer getReason() {
        return reason;
    }
}
