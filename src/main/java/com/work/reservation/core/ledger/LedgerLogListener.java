package com.work.reservation.core.ledger;

import java.util.List;

@FunctionalInterface
public interface LedgerLogListener {

    /**
     * 一批同类型日志。实现方不得把异常抛回订阅方：在部分传输实现上，一次异常会导致后续事件不再投递。
     */
    void onLogs(List<LedgerLog> logs);
}
