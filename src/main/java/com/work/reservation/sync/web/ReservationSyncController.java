package com.work.reservation.sync.web;

import com.work.reservation.core.exception.LedgerReadException;
import com.work.reservation.core.model.ListingState;
import com.work.reservation.core.model.PendingAction;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.sync.ReservationSyncFacade;
import com.work.reservation.sync.refresh.BookingsSnapshot;
import com.work.reservation.sync.web.dto.BookingsView;
import com.work.reservation.sync.web.dto.ListingRequest;
import com.work.reservation.sync.web.dto.PendingActionRequest;
import com.work.reservation.sync.web.dto.PendingActionView;
import com.work.reservation.sync.web.dto.SessionRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1")
public class ReservationSyncController {

    private final ReservationSyncFacade facade;

    public ReservationSyncController(ReservationSyncFacade facade) {
        this.facade = facade;
    }

    @PutMapping("/session")
    public ResponseEntity<Map<String, String>> setSession(@Validated @RequestBody SessionRequest req) {
        facade.setSessionAddress(req.getAddress());
        return ResponseEntity.ok(Collections.singletonMap("address", facade.getSessionAddress()));
    }

    @PostMapping("/reservations/{key}/pending-confirmation")
    public ResponseEntity<PendingActionView> pendingConfirmation(@PathVariable String key,
                                                                 @RequestBody(required = false) PendingActionRequest req) {
        PendingActionRequest r = req == null ? new PendingActionRequest() : req;
        PendingAction a = facade.registerPendingConfirmation(key, r.getTokenId(), r.getRequester());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(toView(a));
    }

    @PostMapping("/reservations/{key}/pending-cancellation")
    public ResponseEntity<PendingActionView> pendingCancellation(@PathVariable String key,
                                                                 @RequestBody(required = false) PendingActionRequest req) {
        PendingActionRequest r = req == null ? new PendingActionRequest() : req;
        PendingAction a = facade.registerPendingCancellation(key, r.getTokenId(), r.getRequester());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(toView(a));
    }

    @GetMapping("/reservations/pending")
    public List<PendingActionView> pending() {
        return facade.pendingActions().stream().map(this::toView).collect(Collectors.toList());
    }

    @GetMapping("/reservations/{key}")
    public Map<String, Object> reservation(@PathVariable String key) {
        return facade.getEffectiveBooking(key);
    }

    @PutMapping("/reservations/{key}/optimistic")
    public Map<String, Object> setOptimisticBooking(@PathVariable String key, @RequestBody Map<String, Object> state) {
        facade.setOptimisticBooking(key, state);
        return facade.getEffectiveBooking(key);
    }

    @PostMapping("/reservations/{key}/optimistic/complete")
    public ResponseEntity<Void> completeOptimisticBooking(@PathVariable String key) {
        facade.completeOptimisticBooking(key);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/reservations/{key}/optimistic")
    public ResponseEntity<Void> clearOptimisticBooking(@PathVariable String key) {
        return facade.clearOptimisticBooking(key)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/bookings")
    public BookingsView bookings(@RequestParam(value = "force", defaultValue = "false") boolean force) {
        return toView(facade.fetchBookings(force));
    }

    @PostMapping("/bookings/refresh")
    public BookingsView refresh() {
        return toView(facade.refreshBookings());
    }

    @GetMapping("/labs/{labId}/listing")
    public ListingState listing(@PathVariable String labId,
                                @RequestParam(value = "serverListed", required = false) Boolean serverListed) {
        return facade.getEffectiveListing(labId, serverListed);
    }

    @PutMapping("/labs/{labId}/listing/optimistic")
    public ListingState setOptimisticListing(@PathVariable String labId, @Validated @RequestBody ListingRequest req) {
        facade.setOptimisticListing(labId, req.getListed(), req.isPending());
        return facade.getEffectiveListing(labId, null);
    }

    @PostMapping("/labs/{labId}/listing/optimistic/complete")
    public ResponseEntity<Void> completeOptimisticListing(@PathVariable String labId) {
        facade.completeOptimisticListing(labId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/labs/{labId}/listing/optimistic")
    public ResponseEntity<Void> clearOptimisticListing(@PathVariable String labId) {
        facade.clearOptimisticListing(labId);
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    @ExceptionHandler(LedgerReadException.class)
    public ResponseEntity<String> handleLedgerRead(LedgerReadException e) {
        HttpStatus status = e.isRateLimited() ? HttpStatus.TOO_MANY_REQUESTS : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(e.getMessage());
    }

    private PendingActionView toView(PendingAction a) {
        PendingActionView v = new PendingActionView();
        v.setReservationKey(a.getReservationKey().value());
        v.setKind(a.getKind().name());
        v.setTokenId(a.getTokenId());
        v.setRequester(a.getRequesterAddress());
        v.setCreatedAt(a.getCreatedAt());
        v.setAttempts(a.getAttempts());
        return v;
    }

    private BookingsView toView(BookingsSnapshot s) {
        BookingsView v = new BookingsView();
        v.setAllBookings(toRows(s.getAllBookings()));
        v.setUserBookings(toRows(s.getUserBookings()));
        v.setUsingCache(s.isUsingCache());
        v.setHasError(s.isHasError());
        v.setConsecutiveAttempts(s.getConsecutiveAttempts());
        v.setLastFetchAt(s.getLastFetchAt());
        v.setNextRetryAt(s.getNextRetryAt());
        return v;
    }

    private static List<Map<String, Object>> toRows(List<ReservationRecord> records) {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (ReservationRecord r : records) {
            rows.add(ReservationSyncFacade.toServerState(r));
        }
        return rows;
    }
}
