package com.work.reservation.core.optimistic;

import com.work.reservation.MutableClock;
import com.work.reservation.core.model.ListingState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class OptimisticUiStateTest {

    private static final Duration PENDING_MAX_AGE = Duration.ofMinutes(2);
    private static final Duration COMPLETED_MAX_AGE = Duration.ofMinutes(15);

    @Test
    public void listing_overlay_wins_over_server_until_swept() {
        MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        OptimisticUiState state = new OptimisticUiState(clock);

        state.setOptimisticListingState(7, true, true);
        state.completeOptimisticListingState(7);

        // 服务端还没同步，覆盖层继续生效
        assertEquals(new ListingState(true, false, OptimisticUiState.OP_LISTING),
                state.getEffectiveListingState("7", false));

        clock.advance(Duration.ofMinutes(14));
        assertEquals(0, state.sweep(PENDING_MAX_AGE, COMPLETED_MAX_AGE));
        assertTrue(state.getEffectiveListingState(7, false).isListed());

        clock.advance(Duration.ofMinutes(2));
        assertEquals(1, state.sweep(PENDING_MAX_AGE, COMPLETED_MAX_AGE));
        assertEquals(new ListingState(false, false, null), state.getEffectiveListingState(7, false));
    }

    @Test
    public void missing_server_value_reads_as_not_listed() {
        OptimisticUiState state = new OptimisticUiState(MutableClock.startingAt("2024-01-01T00:00:00Z"));
        ListingState effective = state.getEffectiveListingState(1, null);
        assertFalse(effective.isListed());
        assertFalse(effective.isPending());
    }

    @Test
    public void pending_entry_expires_on_pending_max_age() {
        MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        OptimisticUiState state = new OptimisticUiState(clock);
        state.setOptimisticListingState(3, false, true);

        clock.advance(Duration.ofSeconds(119));
        assertEquals(0, state.sweep(PENDING_MAX_AGE, COMPLETED_MAX_AGE));
        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, state.sweep(PENDING_MAX_AGE, COMPLETED_MAX_AGE));
        assertEquals(0, state.size());
    }

    @Test
    public void booking_overlay_merges_fields_and_keys_are_normalized() {
        OptimisticUiState state = new OptimisticUiState(MutableClock.startingAt("2024-01-01T00:00:00Z"));

        Map<String, Object> first = new HashMap<>();
        first.put("status", "requesting");
        first.put("isPending", true);
        state.setOptimisticBookingState("0xABC", first);

        Map<String, Object> second = new HashMap<>();
        second.put("note", "x");
        state.setOptimisticBookingState(" 0xabc ", second);

        Map<String, Object> server = new HashMap<>();
        server.put("status", "PENDING");
        server.put("renter", "0x1");

        Map<String, Object> effective = state.getEffectiveBookingState("0xabc", server);
        assertEquals("requesting", effective.get("status"));
        assertEquals("x", effective.get("note"));
        assertEquals("0x1", effective.get("renter"));
        assertEquals(Boolean.TRUE, effective.get("isPending"));

        assertTrue(state.clearOptimisticBookingState("0xAbC"));
        assertEquals(server, state.getEffectiveBookingState("0xabc", server));
        assertTrue(state.getEffectiveBookingState("0xabc", null).isEmpty());
    }

    @Test
    public void completing_booking_overlay_flips_pending_flag() {
        OptimisticUiState state = new OptimisticUiState(MutableClock.startingAt("2024-01-01T00:00:00Z"));
        Map<String, Object> fields = new HashMap<>();
        fields.put("isPending", true);
        state.setOptimisticBookingState("rk-1", fields);

        state.completeOptimisticBookingState("rk-1");

        assertEquals(Boolean.FALSE, state.getEffectiveBookingState("rk-1", null).get("isPending"));
        assertTrue(state.hasOptimisticBookingState("rk-1"));
    }

    @Test
    public void null_lab_id_is_rejected() {
        OptimisticUiState state = new OptimisticUiState(MutableClock.startingAt("2024-01-01T00:00:00Z"));
        assertThrows(IllegalArgumentException.class, () -> state.setOptimisticListingState(null, true, true));
    }
}
