package com.work.reservation.sync.reconcile;

/**
 * 定案来源：事件订阅 or 兜底轮询。两条路径走同一套对账步骤。
 */
public enum ReconcileSource {
    EVENT,
    POLL
}
