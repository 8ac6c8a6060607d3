package com.work.reservation.demo.notify;

import com.work.reservation.core.model.ReservationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 信号监听示例：记录日志并计数。业务方可按同样方式挂接刷新列表、关闭弹窗等动作。
 */
@Component
public class ReservationSignalLogger {

    private static final Logger log = LoggerFactory.getLogger(ReservationSignalLogger.class);

    private final AtomicLong received = new AtomicLong();

    @EventListener
    public void onSignal(ReservationSignalEvent event) {
        ReservationSignal s = event.getSignal();
        received.incrementAndGet();
        log.info("[signal] {} key={} tokenId={} notified={} reason={}",
                s.getType().getWireName(), s.getReservationKey(), s.getTokenId(), s.isNotified(), s.getReason());
    }

    public long getReceived() {
        return received.get();
    }
}
