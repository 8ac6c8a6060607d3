package com.work.reservation.demo.web;

import com.work.reservation.core.exception.LedgerRateLimitedException;
import com.work.reservation.core.exception.LedgerReadException;
import com.work.reservation.demo.ledger.MockLedger;
import com.work.reservation.demo.web.dto.MockRequestReservation;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.Map;

/**
 * demo 场景下驱动内存账本：模拟合约状态变更，以及事件丢失/读失败。
 */
@RestController
@RequestMapping("/api/demo/ledger")
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "mock", matchIfMissing = true)
public class MockLedgerController {

    private final MockLedger ledger;

    public MockLedgerController(MockLedger ledger) {
        this.ledger = ledger;
    }

    @PostMapping("/reservations/{key}/request")
    public ResponseEntity<Void> request(@PathVariable String key, @Validated @RequestBody MockRequestReservation req) {
        ledger.requestReservation(key, req.getTokenId(), req.getRenter(), req.getStart(), req.getEnd());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/reservations/{key}/confirm")
    public ResponseEntity<Void> confirm(@PathVariable String key) {
        ledger.confirm(key);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/reservations/{key}/deny")
    public ResponseEntity<Void> deny(@PathVariable String key,
                                     @RequestParam(value = "reason", defaultValue = "0") int reason) {
        ledger.deny(key, reason);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/reservations/{key}/cancel-booking")
    public ResponseEntity<Void> cancelBooking(@PathVariable String key) {
        ledger.cancelBooking(key);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/reservations/{key}/cancel-request")
    public ResponseEntity<Void> cancelRequest(@PathVariable String key) {
        ledger.cancelRequest(key);
        return ResponseEntity.ok().build();
    }

    @PutMapping("/drop-events")
    public Map<String, Boolean> dropEvents(@RequestParam("enabled") boolean enabled) {
        ledger.setDropEvents(enabled);
        return Collections.singletonMap("dropEvents", ledger.isDropEvents());
    }

    @PutMapping("/read-failure")
    public Map<String, Boolean> readFailure(@RequestParam("enabled") boolean enabled,
                                            @RequestParam(value = "rateLimited", defaultValue = "false") boolean rateLimited) {
        if (!enabled) {
            ledger.setReadFailure(null);
        } else if (rateLimited) {
            ledger.setReadFailure(new LedgerRateLimitedException("simulated 429 Too Many Requests"));
        } else {
            ledger.setReadFailure(new LedgerReadException("simulated ledger outage"));
        }
        return Collections.singletonMap("readFailure", enabled);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
