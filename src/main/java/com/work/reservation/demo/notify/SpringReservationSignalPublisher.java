package com.work.reservation.demo.notify;

import com.work.reservation.core.model.ReservationSignal;
import com.work.reservation.core.notify.ReservationSignalPublisher;
import org.springframework.context.ApplicationEventPublisher;

/**
 * 通过 Spring 事件总线广播信号，监听方用 @EventListener 订阅即可。
 */
public class SpringReservationSignalPublisher implements ReservationSignalPublisher {

    private final ApplicationEventPublisher publisher;

    public SpringReservationSignalPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void publish(ReservationSignal signal) {
        publisher.publishEvent(new ReservationSignalEvent(this, signal));
    }
}
