package com.work.reservation.core.ledger;

import com.work.reservation.core.exception.LedgerReadException;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.ReservationRecord;

import java.util.List;

/**
 * 账本读端口（合约只读调用）。
 *
 * 实现方在 RPC 失败时抛 {@link LedgerReadException}；上游限流抛其子类 LedgerRateLimitedException。
 */
public interface LedgerReader {

    /**
     * 按 key 读取预约。链上不存在时返回 renter 为零地址的记录，而不是 null。
     */
    ReservationRecord getReservation(ReservationKey key);

    /**
     * 批量读取全部预约（列表刷新用）。
     */
    List<ReservationRecord> listReservations();
}
