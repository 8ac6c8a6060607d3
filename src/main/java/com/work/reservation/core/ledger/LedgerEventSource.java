package com.work.reservation.core.ledger;

import com.work.reservation.core.model.ReservationEventType;

/**
 * 合约事件订阅端口。投递不保证送达，可能静默丢失（因此需要兜底轮询）。
 */
public interface LedgerEventSource {

    LedgerSubscription subscribe(ReservationEventType type, LedgerLogListener listener);
}
