package com.work.reservation.sync.reconcile;

import com.work.reservation.core.ledger.LedgerLog;
import com.work.reservation.core.model.ReservationEvent;
import com.work.reservation.core.model.ReservationEventType;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.support.LedgerValues;

/**
 * 将订阅投递的原始日志参数规范化为 {@link ReservationEvent}。
 *
 * 合约里 tokenId 字段在不同事件中叫 tokenId 或 labId，两者都接受。
 */
public class ReservationEventDecoder {

    /**
     * @return 缺少 reservationKey 时返回 null（该条日志无法关联任何状态）
     */
    public ReservationEvent decode(ReservationEventType type, LedgerLog log) {
        if (type == null || log == null) {
            return null;
        }
        ReservationKey key = ReservationKey.ofNullable(log.arg("reservationKey"));
        if (key == null) {
            return null;
        }
        Object rawToken = log.arg("tokenId");
        if (rawToken == null) {
            rawToken = log.arg("labId");
        }
        return new ReservationEvent(type, key,
                LedgerValues.tokenId(rawToken),
                LedgerValues.address(log.arg("renter")),
                LedgerValues.asLong(log.arg("start")),
                LedgerValues.asLong(log.arg("end")),
                LedgerValues.asInteger(log.arg("reason")));
    }
}
