package com.work.reservation.demo.notify;

import com.work.reservation.core.model.ReservationSignal;
import org.springframework.context.ApplicationEvent;

public class ReservationSignalEvent extends ApplicationEvent {

    private final ReservationSignal signal;

    public ReservationSignalEvent(Object source, ReservationSignal signal) {
        super(source);
        this.signal = signal;
    }

    public ReservationSignal getSignal() {
        return signal;
    }
}
