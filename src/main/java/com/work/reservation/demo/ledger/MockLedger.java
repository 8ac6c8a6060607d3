package com.work.reservation.demo.ledger;

import com.work.reservation.core.exception.LedgerReadException;
import com.work.reservation.core.ledger.LedgerEventSource;
import com.work.reservation.core.ledger.LedgerLog;
import com.work.reservation.core.ledger.LedgerLogListener;
import com.work.reservation.core.ledger.LedgerReader;
import com.work.reservation.core.ledger.LedgerSubscription;
import com.work.reservation.core.model.ReservationEventType;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.core.model.ReservationStatus;
import com.work.reservation.core.support.LedgerValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版账本，仅用于 demo 与测试，真实项目请替换为业务自己的实现。
 *
 * 支持模拟两类不可靠：事件丢失（{@link #setDropEvents(boolean)}）与读失败（{@link #setReadFailure(RuntimeException)}）。
 */
public class MockLedger implements LedgerReader, LedgerEventSource {

    private static final Logger log = LoggerFactory.getLogger(MockLedger.class);

    private final Clock clock;
    private final Map<ReservationKey, ReservationRecord> reservations = new ConcurrentHashMap<>();
    private final Map<ReservationEventType, List<LedgerLogListener>> listeners = new EnumMap<>(ReservationEventType.class);
    private final AtomicLong blockNumber = new AtomicLong(1);
    private volatile boolean dropEvents;
    private volatile RuntimeException readFailure;

    public MockLedger(Clock clock) {
        this.clock = clock;
        for (ReservationEventType type : ReservationEventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    @Override
    public ReservationRecord getReservation(ReservationKey key) {
        failIfConfigured();
        ReservationRecord r = reservations.get(key);
        if (r == null) {
            // 合约对不存在的 key 返回零值结构体
            return new ReservationRecord(key, null, LedgerValues.ZERO_ADDRESS, "0", 0L, 0L, 0);
        }
        return r;
    }

    @Override
    public List<ReservationRecord> listReservations() {
        failIfConfigured();
        return new ArrayList<>(reservations.values());
    }

    @Override
    public LedgerSubscription subscribe(ReservationEventType type, LedgerLogListener listener) {
        List<LedgerLogListener> list = listeners.get(type);
        list.add(listener);
        return () -> list.remove(listener);
    }

    // ---- 模拟合约写操作 ----

    public void requestReservation(Object reservationKey, Object tokenId, String renter, long start, long end) {
        ReservationKey key = ReservationKey.of(reservationKey);
        String token = LedgerValues.tokenId(tokenId);
        reservations.put(key, new ReservationRecord(key, token, renter, "0", start, end,
                ReservationStatus.PENDING.getCode()));
        Map<String, Object> args = baseArgs(key, token, renter);
        args.put("start", start);
        args.put("end", end);
        emit(ReservationEventType.REQUESTED, args);
    }

    public void confirm(Object reservationKey) {
        ReservationRecord r = updateStatus(reservationKey, ReservationStatus.BOOKED);
        emit(ReservationEventType.CONFIRMED, baseArgs(r.getReservationKey(), r.getTokenId(), r.getRenter()));
    }

    public void deny(Object reservationKey, int reason) {
        ReservationRecord r = updateStatus(reservationKey, ReservationStatus.CANCELLED);
        Map<String, Object> args = baseArgs(r.getReservationKey(), r.getTokenId(), null);
        args.put("reason", reason);
        emit(ReservationEventType.DENIED, args);
    }

    public void cancelBooking(Object reservationKey) {
        ReservationRecord r = updateStatus(reservationKey, ReservationStatus.CANCELLED);
        emit(ReservationEventType.BOOKING_CANCELED, baseArgs(r.getReservationKey(), r.getTokenId(), null));
    }

    public void cancelRequest(Object reservationKey) {
        ReservationRecord r = updateStatus(reservationKey, ReservationStatus.CANCELLED);
        emit(ReservationEventType.REQUEST_CANCELED, baseArgs(r.getReservationKey(), r.getTokenId(), null));
    }

    /**
     * 直接投递一条日志（不改状态），用于构造任意参数编码。
     */
    public void emit(ReservationEventType type, Map<String, Object> args) {
        if (dropEvents) {
            log.info("[mock-ledger] drop {} args={}", type.getEventName(), args);
            return;
        }
        LedgerLog entry = new LedgerLog(args, "0xmock" + Long.toHexString(clock.millis()), blockNumber.getAndIncrement());
        List<LedgerLog> batch = Collections.singletonList(entry);
        for (LedgerLogListener l : listeners.get(type)) {
            l.onLogs(batch);
        }
    }

    public void put(ReservationRecord record) {
        reservations.put(record.getReservationKey(), record);
    }

    public void setDropEvents(boolean dropEvents) {
        this.dropEvents = dropEvents;
    }

    public boolean isDropEvents() {
        return dropEvents;
    }

    public void setReadFailure(RuntimeException readFailure) {
        this.readFailure = readFailure;
    }

    public int listenerCount(ReservationEventType type) {
        return listeners.get(type).size();
    }

    private ReservationRecord updateStatus(Object reservationKey, ReservationStatus status) {
        ReservationKey key = ReservationKey.of(reservationKey);
        ReservationRecord cur = reservations.get(key);
        if (cur == null) {
            throw new IllegalArgumentException("reservation 不存在: " + key);
        }
        ReservationRecord next = new ReservationRecord(key, cur.getTokenId(), cur.getRenter(), cur.getPrice(),
                cur.getStart(), cur.getEnd(), status.getCode());
        reservations.put(key, next);
        return next;
    }

    private static Map<String, Object> baseArgs(ReservationKey key, String tokenId, String renter) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("reservationKey", key.value());
        args.put("tokenId", tokenId);
        if (renter != null) {
            args.put("renter", renter);
        }
        return args;
    }

    private void failIfConfigured() {
        RuntimeException failure = readFailure;
        if (failure != null) {
            throw failure instanceof LedgerReadException ? failure : new LedgerReadException("mock read failed", failure);
        }
    }
}
