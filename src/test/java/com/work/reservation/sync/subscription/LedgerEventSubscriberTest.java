package com.work.reservation.sync.subscription;

import com.work.reservation.MutableClock;
import com.work.reservation.core.cache.ReservationCacheManager;
import com.work.reservation.core.ledger.LedgerEventSource;
import com.work.reservation.core.ledger.LedgerLogListener;
import com.work.reservation.core.ledger.LedgerSubscription;
import com.work.reservation.core.model.NotificationClass;
import com.work.reservation.core.model.PendingActionKind;
import com.work.reservation.core.model.ReservationEventType;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.UserNotification;
import com.work.reservation.core.notify.ReservationSignalPublisher;
import com.work.reservation.core.session.ReservationSession;
import com.work.reservation.core.session.SessionIdentity;
import com.work.reservation.demo.ledger.MockLedger;
import com.work.reservation.demo.notify.NotificationFeed;
import com.work.reservation.sync.config.ReservationSyncProperties;
import com.work.reservation.sync.poller.BackupPoller;
import com.work.reservation.sync.poller.PollOutcome;
import com.work.reservation.sync.reconcile.EventReconciliationEngine;
import com.work.reservation.sync.reconcile.ReservationEventDecoder;
import com.work.reservation.sync.refresh.CachedReservationReader;
import com.work.reservation.sync.support.metrics.NoopReservationSyncMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 内存账本 + 真实对账引擎的端到端场景。
 */
public class LedgerEventSubscriberTest {

    private static final String ME = "0xabc";

    private MutableClock clock;
    private MockLedger ledger;
    private ReservationSession session;
    private NotificationFeed feed;
    private ReservationSyncProperties props;
    private EventReconciliationEngine engine;
    private LedgerEventSubscriber subscriber;

    @BeforeEach
    public void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        ledger = new MockLedger(clock);
        session = new ReservationSession(clock, new SessionIdentity(ME));
        feed = new NotificationFeed(50);
        props = new ReservationSyncProperties();
        ReservationCacheManager cache = new ReservationCacheManager(1000, Duration.ofHours(1), clock);
        engine = new EventReconciliationEngine(session, new CachedReservationReader(ledger, cache, props), cache,
                new ReservationEventDecoder(), feed, mock(ReservationSignalPublisher.class), props,
                new NoopReservationSyncMetrics(), clock);
        subscriber = new LedgerEventSubscriber(ledger, engine);
    }

    @Test
    public void start_and_stop_manage_one_subscription_per_event_type() {
        subscriber.start();
        assertEquals(ReservationEventType.values().length, subscriber.activeSubscriptions());
        for (ReservationEventType type : ReservationEventType.values()) {
            assertEquals(1, ledger.listenerCount(type));
        }

        subscriber.stop();
        assertEquals(0, subscriber.activeSubscriptions());
        assertEquals(0, ledger.listenerCount(ReservationEventType.CONFIRMED));
    }

    @Test
    public void own_request_then_confirmation_notifies_each_step_once() {
        subscriber.start();

        ledger.requestReservation("rk-1", 7, ME, 100L, 200L);
        ReservationKey key = ReservationKey.of("rk-1");
        assertTrue(session.getPendingActions().isTracked(key, PendingActionKind.CONFIRMATION));

        ledger.confirm("rk-1");

        List<UserNotification> notes = feed.recent();
        assertEquals(2, notes.size());
        assertEquals(NotificationClass.CONFIRMED, notes.get(0).getNotificationClass());
        assertEquals(NotificationClass.REQUESTED, notes.get(1).getNotificationClass());
        assertEquals("Reservation confirmed for Lab 7", notes.get(0).getMessage());
        assertEquals(0, session.getPendingActions().size());
    }

    @Test
    public void foreign_denial_is_not_notified() {
        subscriber.start();

        ledger.requestReservation("rk-9", 7, "0xdef", 100L, 200L);
        ledger.deny("rk-9", 3);

        assertTrue(feed.recent().isEmpty());
    }

    @Test
    public void dropped_confirmation_is_recovered_by_backup_poll() {
        subscriber.start();
        ReservationKey key = ReservationKey.of("rk-2");
        session.getPendingActions().track(key, 4, ME, PendingActionKind.CONFIRMATION);
        ledger.setDropEvents(true);
        ledger.requestReservation("rk-2", 4, ME, 100L, 200L);
        ledger.confirm("rk-2");
        assertTrue(feed.recent().isEmpty());

        BackupPoller poller = new BackupPoller(props, session, ledger, engine, new NoopReservationSyncMetrics(), clock);
        poller.init();
        try {
            assertEquals(Collections.singletonList(PollOutcome.CONFIRMED), poller.pollOnce());
        } finally {
            poller.destroy();
        }

        ledger.setDropEvents(false);
        ledger.emit(ReservationEventType.CONFIRMED, Collections.<String, Object>singletonMap("reservationKey", "rk-2"));

        List<UserNotification> notes = feed.recent();
        assertEquals(1, notes.size());
        assertEquals(NotificationClass.CONFIRMED, notes.get(0).getNotificationClass());
    }

    @Test
    public void failed_subscription_does_not_block_the_others() {
        LedgerEventSource source = mock(LedgerEventSource.class);
        when(source.subscribe(any(), any())).thenReturn(mock(LedgerSubscription.class));
        when(source.subscribe(eq(ReservationEventType.DENIED), any())).thenThrow(new IllegalStateException("filter rejected"));

        LedgerEventSubscriber s = new LedgerEventSubscriber(source, engine);
        s.start();

        assertEquals(ReservationEventType.values().length - 1, s.activeSubscriptions());
    }

    @Test
    public void listener_failure_is_not_thrown_back_to_the_source() {
        EventReconciliationEngine failing = mock(EventReconciliationEngine.class);
        doThrow(new IllegalStateException("boom")).when(failing).onLogs(any(), any());
        LedgerEventSubscriber s = new LedgerEventSubscriber(ledger, failing);
        s.start();

        assertDoesNotThrow(() -> ledger.requestReservation("rk-3", 1, ME, 1L, 2L));
        verify(failing).onLogs(eq(ReservationEventType.REQUESTED), anyList());
    }

    @Test
    public void stop_cancels_subscriptions_even_if_one_cancel_fails() {
        LedgerEventSource source = mock(LedgerEventSource.class);
        LedgerSubscription broken = mock(LedgerSubscription.class);
        doThrow(new IllegalStateException("gone")).when(broken).cancel();
        LedgerSubscription ok = mock(LedgerSubscription.class);
        when(source.subscribe(any(), any(LedgerLogListener.class))).thenReturn(broken, ok);

        LedgerEventSubscriber s = new LedgerEventSubscriber(source, engine);
        s.start();
        s.stop();

        verify(ok, atLeastOnce()).cancel();
        assertEquals(0, s.activeSubscriptions());
    }
}
