package com.work.reservation.sync.poller;

import com.work.reservation.MutableClock;
import com.work.reservation.core.cache.ReservationCacheManager;
import com.work.reservation.core.exception.LedgerReadException;
import com.work.reservation.core.ledger.LedgerLog;
import com.work.reservation.core.ledger.LedgerReader;
import com.work.reservation.core.model.NotificationClass;
import com.work.reservation.core.model.PendingActionKind;
import com.work.reservation.core.model.ReservationEventType;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.core.model.ReservationStatus;
import com.work.reservation.core.model.SignalType;
import com.work.reservation.core.notify.ReservationSignalPublisher;
import com.work.reservation.core.notify.UserNotifier;
import com.work.reservation.core.session.ReservationSession;
import com.work.reservation.core.session.SessionIdentity;
import com.work.reservation.sync.config.ReservationSyncProperties;
import com.work.reservation.sync.reconcile.EventReconciliationEngine;
import com.work.reservation.sync.reconcile.ReservationEventDecoder;
import com.work.reservation.sync.refresh.CachedReservationReader;
import com.work.reservation.sync.support.metrics.ReservationSyncMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class BackupPollerTest {

    private static final String ME = "0xabc";

    private MutableClock clock;
    private ReservationSession session;
    private LedgerReader ledgerReader;
    private UserNotifier notifier;
    private ReservationSignalPublisher signals;
    private ReservationSyncMetrics metrics;
    private EventReconciliationEngine engine;
    private BackupPoller poller;

    @BeforeEach
    public void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        session = new ReservationSession(clock, new SessionIdentity(ME));
        ledgerReader = mock(LedgerReader.class);
        notifier = mock(UserNotifier.class);
        signals = mock(ReservationSignalPublisher.class);
        metrics = mock(ReservationSyncMetrics.class);

        ReservationSyncProperties props = new ReservationSyncProperties();
        props.setPollInterval(Duration.ofSeconds(10));
        props.setPendingActionTimeout(Duration.ofSeconds(120));
        props.setPollWorkers(2);

        engine = new EventReconciliationEngine(session, mock(CachedReservationReader.class),
                new ReservationCacheManager(1000, Duration.ofHours(1), clock), new ReservationEventDecoder(),
                notifier, signals, props, metrics, clock);
        poller = new BackupPoller(props, session, ledgerReader, engine, metrics, clock);
        poller.init();
    }

    @AfterEach
    public void tearDown() {
        poller.destroy();
    }

    @Test
    public void action_past_timeout_is_evicted_even_if_lookup_fails() {
        ReservationKey key = ReservationKey.of("rk-old");
        session.getPendingActions().track(key, "1", ME, PendingActionKind.CONFIRMATION);
        when(ledgerReader.getReservation(any())).thenThrow(new LedgerReadException("down"));

        clock.advance(Duration.ofSeconds(121));
        List<PollOutcome> outcomes = poller.pollOnce();

        assertEquals(Collections.singletonList(PollOutcome.EVICTED), outcomes);
        assertEquals(0, session.getPendingActions().size());
        verify(ledgerReader, never()).getReservation(any());
        verify(notifier, never()).deliver(any());
    }

    @Test
    public void lookup_failure_increments_attempts_and_throttles_next_check() {
        ReservationKey key = ReservationKey.of("rk-err");
        session.getPendingActions().track(key, "1", ME, PendingActionKind.CONFIRMATION);
        when(ledgerReader.getReservation(eq(key))).thenThrow(new LedgerReadException("timeout"));

        assertEquals(Collections.singletonList(PollOutcome.LOOKUP_FAILED), poller.pollOnce());
        assertEquals(1, session.getPendingActions().get(key, PendingActionKind.CONFIRMATION).getAttempts());

        clock.advance(Duration.ofSeconds(5));
        assertEquals(Collections.singletonList(PollOutcome.THROTTLED), poller.pollOnce());

        clock.advance(Duration.ofSeconds(6));
        assertEquals(Collections.singletonList(PollOutcome.LOOKUP_FAILED), poller.pollOnce());
        assertEquals(2, session.getPendingActions().get(key, PendingActionKind.CONFIRMATION).getAttempts());
        verify(ledgerReader, times(2)).getReservation(eq(key));
    }

    @Test
    public void poll_and_event_racing_on_confirmation_notify_once() {
        ReservationKey key = ReservationKey.of("rk-1");
        session.getPendingActions().track(key, "5", ME, PendingActionKind.CONFIRMATION);
        when(ledgerReader.getReservation(eq(key))).thenReturn(record(key, ME, ReservationStatus.BOOKED));

        clock.advance(Duration.ofSeconds(10));
        assertEquals(Collections.singletonList(PollOutcome.CONFIRMED), poller.pollOnce());

        Map<String, Object> args = new HashMap<>();
        args.put("reservationKey", "rk-1");
        args.put("tokenId", "5");
        args.put("renter", ME);
        engine.onLogs(ReservationEventType.CONFIRMED, Collections.singletonList(LedgerLog.of(args)));

        verify(notifier, times(1)).deliver(argThat(n -> n.getNotificationClass() == NotificationClass.CONFIRMED));
        assertEquals(0, session.getPendingActions().size());
    }

    @Test
    public void pending_status_recovers_missed_request_notification_once() {
        ReservationKey key = ReservationKey.of("rk-req");
        session.getPendingActions().track(key, "9", ME, PendingActionKind.CONFIRMATION);
        when(ledgerReader.getReservation(eq(key))).thenReturn(record(key, ME, ReservationStatus.PENDING));

        assertEquals(Collections.singletonList(PollOutcome.REQUEST_RECOVERED), poller.pollOnce());
        clock.advance(Duration.ofSeconds(10));
        assertEquals(Collections.singletonList(PollOutcome.STILL_PENDING), poller.pollOnce());

        verify(notifier, times(1)).deliver(argThat(n -> n.getNotificationClass() == NotificationClass.REQUESTED));
        assertTrue(session.getPendingActions().isTracked(key, PendingActionKind.CONFIRMATION));
    }

    @Test
    public void cancelled_status_on_confirmation_is_reported_as_denied() {
        ReservationKey key = ReservationKey.of("rk-den");
        session.getPendingActions().track(key, "2", ME, PendingActionKind.CONFIRMATION);
        when(ledgerReader.getReservation(eq(key))).thenReturn(record(key, ME, ReservationStatus.CANCELLED));

        assertEquals(Collections.singletonList(PollOutcome.DENIED), poller.pollOnce());

        verify(notifier).deliver(argThat(n -> n.getNotificationClass() == NotificationClass.DENIED));
        verify(signals).publish(argThat(s -> s.getType() == SignalType.RESERVATION_REQUEST_DENIED && s.isNotified()));
        assertEquals(0, session.getPendingActions().size());
    }

    @Test
    public void cancellation_completes_when_status_is_cancelled() {
        ReservationKey key = ReservationKey.of("rk-can");
        session.getPendingActions().track(key, "3", ME, PendingActionKind.CANCELLATION);
        when(ledgerReader.getReservation(eq(key))).thenReturn(record(key, ME, ReservationStatus.CANCELLED));

        assertEquals(Collections.singletonList(PollOutcome.CANCELLED), poller.pollOnce());

        verify(notifier).deliver(argThat(n -> n.getNotificationClass() == NotificationClass.CANCELED));
        verify(signals).publish(argThat(s -> s.getType() == SignalType.RESERVATION_CANCELLED));
    }

    @Test
    public void event_resolving_during_lookup_wins() {
        ReservationKey key = ReservationKey.of("rk-race");
        session.getPendingActions().track(key, "4", ME, PendingActionKind.CONFIRMATION);
        when(ledgerReader.getReservation(eq(key))).thenAnswer(inv -> {
            session.getPendingActions().resolve(key);
            return record(key, ME, ReservationStatus.BOOKED);
        });

        assertEquals(Collections.singletonList(PollOutcome.ALREADY_RESOLVED), poller.pollOnce());
        verify(notifier, never()).deliver(any());
    }

    @Test
    public void missing_reservation_keeps_tracking() {
        ReservationKey key = ReservationKey.of("rk-none");
        session.getPendingActions().track(key, "4", ME, PendingActionKind.CONFIRMATION);
        when(ledgerReader.getReservation(eq(key)))
                .thenReturn(new ReservationRecord(key, null, null, "0", 0L, 0L, 0));

        assertEquals(Collections.singletonList(PollOutcome.NOT_FOUND), poller.pollOnce());
        assertTrue(session.getPendingActions().isTracked(key, PendingActionKind.CONFIRMATION));
    }

    @Test
    public void empty_tracker_is_a_noop() {
        assertTrue(poller.pollOnce().isEmpty());
        verifyNoInteractions(ledgerReader);
    }

    @Test
    public void zero_poll_interval_is_rejected_at_startup() {
        ReservationSyncProperties bad = new ReservationSyncProperties();
        bad.setPollInterval(Duration.ZERO);
        BackupPoller p = new BackupPoller(bad, session, ledgerReader, engine, metrics, clock);

        assertThrows(IllegalArgumentException.class, p::init);
    }

    private static ReservationRecord record(ReservationKey key, String renter, ReservationStatus status) {
        return new ReservationRecord(key, "5", renter, "100", 1L, 2L, status.getCode());
    }
}
