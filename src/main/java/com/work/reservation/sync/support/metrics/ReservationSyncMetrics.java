package com.work.reservation.sync.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；需要接入 metrics 时由业务侧提供自定义 Bean。
 */
public interface ReservationSyncMetrics {

    default void eventReceived(String type) {
    }

    default void eventHandlerError(String type) {
    }

    default void notificationFailed(String type) {
    }

    default void reconcile(String type, String source, boolean owned, boolean notified) {
    }

    default void pollCheck(String result) {
    }

    default void bulkRefresh(String result) {
    }

    default void optimisticSwept(int removed) {
    }
}
