package com.work.reservation.sync.subscription;

import com.work.reservation.core.ledger.LedgerEventSource;
import com.work.reservation.core.ledger.LedgerSubscription;
import com.work.reservation.core.model.ReservationEventType;
import com.work.reservation.sync.reconcile.EventReconciliationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;

/**
 * 启动时订阅 5 类预约事件，销毁时退订。回调里的任何异常都不会抛回事件源。
 */
@Component
public class LedgerEventSubscriber {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventSubscriber.class);

    private final LedgerEventSource eventSource;
    private final EventReconciliationEngine engine;
    private final List<LedgerSubscription> subscriptions = new ArrayList<>();

    public LedgerEventSubscriber(LedgerEventSource eventSource, EventReconciliationEngine engine) {
        this.eventSource = eventSource;
        this.engine = engine;
    }

    @PostConstruct
    public synchronized void start() {
        for (ReservationEventType type : ReservationEventType.values()) {
            try {
                subscriptions.add(eventSource.subscribe(type, logs -> {
                    try {
                        engine.onLogs(type, logs);
                    } catch (Exception e) {
                        log.warn("Event listener failed. event={} err={}", type.getEventName(), e.toString());
                    }
                }));
            } catch (Exception e) {
                // 订阅失败不阻塞启动：兜底轮询仍可定案
                log.warn("Subscribe {} failed. err={}", type.getEventName(), e.toString());
            }
        }
        log.info("Subscribed to {} reservation events", subscriptions.size());
    }

    @PreDestroy
    public synchronized void stop() {
        for (LedgerSubscription s : subscriptions) {
            try {
                s.cancel();
            } catch (Exception e) {
                log.warn("Unsubscribe failed. err={}", e.toString());
            }
        }
        subscriptions.clear();
    }

    public synchronized int activeSubscriptions() {
        return subscriptions.size();
    }
}
