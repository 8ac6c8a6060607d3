package com.work.reservation.core.notify;

import com.work.reservation.core.model.ReservationSignal;

/**
 * 解耦信号广播端口：监听方无需出现在对账引擎的依赖图里。
 */
@FunctionalInterface
public interface ReservationSignalPublisher {

    void publish(ReservationSignal signal);

    static ReservationSignalPublisher noop() {
        return signal -> {
        };
    }
}
