package com.work.reservation.core.ledger;

/**
 * 订阅句柄，cancel 可重复调用。
 */
@FunctionalInterface
public interface LedgerSubscription {

    void cancel();
}
