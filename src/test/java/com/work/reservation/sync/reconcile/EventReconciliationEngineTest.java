package com.work.reservation.sync.reconcile;

import com.work.reservation.MutableClock;
import com.work.reservation.core.cache.CacheKeys;
import com.work.reservation.core.cache.ReservationCacheManager;
import com.work.reservation.core.exception.LedgerReadException;
import com.work.reservation.core.ledger.LedgerLog;
import com.work.reservation.core.model.NotificationClass;
import com.work.reservation.core.model.NotificationLevel;
import com.work.reservation.core.model.PendingActionKind;
import com.work.reservation.core.model.ReservationEventType;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.core.model.ReservationSignal;
import com.work.reservation.core.model.SignalType;
import com.work.reservation.core.model.UserNotification;
import com.work.reservation.core.notify.ReservationSignalPublisher;
import com.work.reservation.core.notify.UserNotifier;
import com.work.reservation.core.session.ReservationSession;
import com.work.reservation.core.session.SessionIdentity;
import com.work.reservation.sync.config.ReservationSyncProperties;
import com.work.reservation.sync.refresh.CachedReservationReader;
import com.work.reservation.sync.support.metrics.ReservationSyncMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class EventReconciliationEngineTest {

    private static final String ME = "0xabc";

    private MutableClock clock;
    private ReservationSession session;
    private CachedReservationReader reader;
    private ReservationCacheManager cache;
    private UserNotifier notifier;
    private ReservationSignalPublisher signals;
    private ReservationSyncMetrics metrics;
    private EventReconciliationEngine engine;

    @BeforeEach
    public void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        session = new ReservationSession(clock, new SessionIdentity(ME));
        reader = mock(CachedReservationReader.class);
        cache = new ReservationCacheManager(1000, Duration.ofHours(1), clock);
        notifier = mock(UserNotifier.class);
        signals = mock(ReservationSignalPublisher.class);
        metrics = mock(ReservationSyncMetrics.class);
        engine = new EventReconciliationEngine(session, reader, cache, new ReservationEventDecoder(), notifier,
                signals, new ReservationSyncProperties(), metrics, clock);
    }

    @Test
    public void confirmed_event_for_own_pending_request_notifies_once_and_clears_state() {
        ReservationKey key = ReservationKey.of("rk-1");
        session.getPendingActions().track(key, "5", ME, PendingActionKind.CONFIRMATION);
        Map<String, Object> overlay = new HashMap<>();
        overlay.put("isPending", true);
        session.getOptimisticState().setOptimisticBookingState(key, overlay);
        cache.put(CacheKeys.reservation(key), "cached", Duration.ofMinutes(2));
        cache.put(CacheKeys.token("5"), "cached", Duration.ofMinutes(2));
        cache.put(CacheKeys.userBookings(ME), "cached", Duration.ofMinutes(5));
        cache.put(CacheKeys.SESSION, "cached", Duration.ofMinutes(5));
        cache.put(CacheKeys.userBookings("0xdef"), "cached", Duration.ofMinutes(5));

        engine.onLogs(ReservationEventType.CONFIRMED, Collections.singletonList(log("rk-1", BigInteger.valueOf(5), null)));

        ArgumentCaptor<UserNotification> captor = ArgumentCaptor.forClass(UserNotification.class);
        verify(notifier, times(1)).deliver(captor.capture());
        assertEquals(NotificationClass.CONFIRMED, captor.getValue().getNotificationClass());
        assertEquals(NotificationLevel.SUCCESS, captor.getValue().getLevel());
        assertEquals("5", captor.getValue().getTokenId());

        assertEquals(0, session.getPendingActions().size());
        assertFalse(session.getOptimisticState().hasOptimisticBookingState(key));
        assertFalse(cache.isFresh(CacheKeys.reservation(key)));
        assertFalse(cache.isFresh(CacheKeys.token("5")));
        assertFalse(cache.isFresh(CacheKeys.userBookings(ME)));
        assertFalse(cache.isFresh(CacheKeys.SESSION));
        assertTrue(cache.isFresh(CacheKeys.userBookings("0xdef")));
        verify(signals, never()).publish(any());

        // 重复投递只失效缓存，不再通知
        engine.onLogs(ReservationEventType.CONFIRMED, Collections.singletonList(log("rk-1", 5, ME)));
        verify(notifier, times(1)).deliver(any());
    }

    @Test
    public void denied_event_for_foreign_reservation_only_invalidates_and_signals() {
        ReservationKey key = ReservationKey.of("rk-2");
        when(reader.getReservation(eq(key)))
                .thenReturn(new ReservationRecord(key, "3", "0xdef", "0", 1L, 2L, 4));
        cache.put(CacheKeys.token("3"), "cached", Duration.ofMinutes(2));
        cache.put(CacheKeys.ALL_BOOKINGS, "cached", Duration.ofMinutes(5));

        Map<String, Object> args = new LinkedHashMap<>();
        args.put("reservationKey", "rk-2");
        args.put("labId", "3");
        args.put("reason", BigInteger.valueOf(2));
        engine.onLogs(ReservationEventType.DENIED, Collections.singletonList(LedgerLog.of(args)));

        verify(notifier, never()).deliver(any());
        assertFalse(cache.isFresh(CacheKeys.token("3")));
        assertFalse(cache.isFresh(CacheKeys.ALL_BOOKINGS));

        ArgumentCaptor<ReservationSignal> captor = ArgumentCaptor.forClass(ReservationSignal.class);
        verify(signals, times(1)).publish(captor.capture());
        ReservationSignal s = captor.getValue();
        assertEquals(SignalType.RESERVATION_REQUEST_DENIED, s.getType());
        assertEquals("rk-2", s.getReservationKey());
        assertFalse(s.isNotified());
        assertEquals(Integer.valueOf(2), s.getReason());
    }

    @Test
    public void denied_notification_carries_reason() {
        ReservationKey key = ReservationKey.of("rk-3");
        session.getPendingActions().track(key, "8", ME, PendingActionKind.CONFIRMATION);

        Map<String, Object> args = new HashMap<>();
        args.put("reservationKey", "rk-3");
        args.put("tokenId", 8);
        args.put("reason", 7);
        ReconcileResult result = engine.handleEvent(new ReservationEventDecoder()
                .decode(ReservationEventType.DENIED, LedgerLog.of(args)));

        assertTrue(result.isOwned());
        assertTrue(result.isNotified());
        ArgumentCaptor<UserNotification> captor = ArgumentCaptor.forClass(UserNotification.class);
        verify(notifier).deliver(captor.capture());
        assertEquals(NotificationLevel.ERROR, captor.getValue().getLevel());
        assertEquals(Integer.valueOf(7), captor.getValue().getReason());
        verify(signals).publish(argThat(sig -> sig.isNotified() && sig.getType() == SignalType.RESERVATION_REQUEST_DENIED));
    }

    @Test
    public void requested_event_for_own_address_registers_pending_confirmation() {
        engine.onLogs(ReservationEventType.REQUESTED,
                Collections.singletonList(log("rk-4", 11, "0xABC")));

        ReservationKey key = ReservationKey.of("rk-4");
        assertTrue(session.getPendingActions().isTracked(key, PendingActionKind.CONFIRMATION));
        assertEquals("11", session.getPendingActions().find(key).getTokenId());
        verify(notifier).deliver(argThat(n -> n.getNotificationClass() == NotificationClass.REQUESTED));
        verify(signals).publish(argThat(sig -> sig.getType() == SignalType.RESERVATION_REQUESTED_ONCHAIN && sig.isNotified()));
        verify(reader, never()).getReservation(any());
    }

    @Test
    public void requested_event_for_other_renter_is_not_tracked() {
        engine.onLogs(ReservationEventType.REQUESTED,
                Collections.singletonList(log("rk-5", 11, "0xdef")));

        assertEquals(0, session.getPendingActions().size());
        verify(notifier, never()).deliver(any());
        verify(signals).publish(argThat(sig -> !sig.isNotified()));
    }

    @Test
    public void failed_ownership_lookup_counts_as_foreign() {
        when(reader.getReservation(any())).thenThrow(new LedgerReadException("down"));

        ReconcileResult result = engine.reconcile(ReservationEventType.BOOKING_CANCELED, ReservationKey.of("rk-6"),
                ReconcileContext.empty(), ReconcileSource.EVENT);

        assertFalse(result.isOwned());
        assertFalse(result.isNotified());
        verify(signals).publish(argThat(sig -> sig.getType() == SignalType.RESERVATION_CANCELLED));
    }

    @Test
    public void handler_failure_does_not_stop_the_batch() {
        session.getPendingActions().track(ReservationKey.of("a"), "1", ME, PendingActionKind.CONFIRMATION);
        session.getPendingActions().track(ReservationKey.of("b"), "2", ME, PendingActionKind.CONFIRMATION);
        doThrow(new RuntimeException("boom")).doNothing().when(signals).publish(any());

        assertDoesNotThrow(() -> engine.onLogs(ReservationEventType.DENIED,
                Arrays.asList(log("a", 1, null), log("b", 2, null))));

        verify(signals, times(2)).publish(any());
        verify(metrics, times(1)).eventHandlerError(eq("DENIED"));
        assertEquals(0, session.getPendingActions().size());
    }

    @Test
    public void failed_delivery_still_signals_and_frees_the_gate_for_redelivery() {
        ReservationKey key = ReservationKey.of("rk-9");
        session.getPendingActions().track(key, "4", ME, PendingActionKind.CONFIRMATION);
        doThrow(new IllegalStateException("toast unavailable")).doNothing().when(notifier).deliver(any());

        ReconcileResult first = engine.reconcile(ReservationEventType.DENIED, key,
                new ReconcileContext("4", null, 5), ReconcileSource.EVENT);

        assertTrue(first.isOwned());
        assertFalse(first.isNotified());
        assertFalse(session.getNotificationGate().hasNotified(NotificationClass.DENIED, key));
        verify(metrics).notificationFailed(eq("DENIED"));
        verify(signals).publish(argThat(sig -> sig.getType() == SignalType.RESERVATION_REQUEST_DENIED
                && !sig.isNotified() && Integer.valueOf(5).equals(sig.getReason())));

        // 重复投递的事件不再有在途动作，靠 renter 判定归属
        engine.onLogs(ReservationEventType.DENIED, Collections.singletonList(log("rk-9", 4, ME)));
        engine.onLogs(ReservationEventType.DENIED, Collections.singletonList(log("rk-9", 4, ME)));

        verify(notifier, times(2)).deliver(any());
        assertTrue(session.getNotificationGate().hasNotified(NotificationClass.DENIED, key));
        verify(signals, times(3)).publish(any());
    }

    @Test
    public void key_tracked_as_integer_correlates_with_bytes32_event() {
        BigInteger raw = new BigInteger("abcdef", 16);
        session.getPendingActions().track(ReservationKey.of(raw), "5", ME, PendingActionKind.CONFIRMATION);

        engine.reconcile(ReservationEventType.CONFIRMED, ReservationKey.of(raw),
                new ReconcileContext("5", ME, null), ReconcileSource.POLL);

        Map<String, Object> args = new HashMap<>();
        args.put("reservationKey", new Bytes32(Numeric.toBytesPadded(raw, 32)));
        args.put("tokenId", new Uint256(5));
        args.put("renter", ME);
        engine.onLogs(ReservationEventType.CONFIRMED, Collections.singletonList(LedgerLog.of(args)));
        engine.onLogs(ReservationEventType.CONFIRMED, Collections.singletonList(log("0xABCDEF", 5, ME)));

        verify(notifier, times(1)).deliver(any());
        assertEquals(0, session.getPendingActions().size());
    }

    @Test
    public void log_without_reservation_key_is_skipped() {
        Map<String, Object> args = new HashMap<>();
        args.put("tokenId", 1);
        engine.onLogs(ReservationEventType.CONFIRMED, Collections.singletonList(LedgerLog.of(args)));

        verifyNoInteractions(notifier, signals, reader);
    }

    private static LedgerLog log(String key, Object tokenId, String renter) {
        Map<String, Object> args = new HashMap<>();
        args.put("reservationKey", key);
        args.put("tokenId", tokenId);
        if (renter != null) {
            args.put("renter", renter);
        }
        return LedgerLog.of(args);
    }
}
