package com.work.reservation.sync;

import com.work.reservation.core.model.ListingState;
import com.work.reservation.core.model.PendingAction;
import com.work.reservation.core.model.PendingActionKind;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.core.optimistic.OptimisticUiState;
import com.work.reservation.core.session.ReservationSession;
import com.work.reservation.core.session.SessionIdentity;
import com.work.reservation.sync.refresh.BookingsSnapshot;
import com.work.reservation.sync.refresh.CachedReservationReader;
import com.work.reservation.sync.refresh.ReservationListRefresher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对宿主暴露的统一入口：登记在途动作、写/读乐观状态、读取预约数据。
 */
@Service
public class ReservationSyncFacade {

    private static final Logger log = LoggerFactory.getLogger(ReservationSyncFacade.class);

    private final ReservationSession session;
    private final CachedReservationReader reservationReader;
    private final ReservationListRefresher listRefresher;

    public ReservationSyncFacade(ReservationSession session,
                                 CachedReservationReader reservationReader,
                                 ReservationListRefresher listRefresher) {
        this.session = session;
        this.reservationReader = reservationReader;
        this.listRefresher = listRefresher;
    }

    public void setSessionAddress(String address) {
        SessionIdentity identity = session.getIdentity();
        boolean changed = !identity.matches(address);
        identity.setAddress(address);
        if (changed) {
            // 旧地址的自动重试不再有意义
            listRefresher.cancelScheduledRetry();
        }
        log.info("Session address set to {}", identity.getAddress());
    }

    public String getSessionAddress() {
        return session.getIdentity().getAddress();
    }

    /**
     * 提交预约请求交易后调用；requester 为空时使用会话地址。
     */
    public PendingAction registerPendingConfirmation(Object reservationKey, Object tokenId, String requester) {
        return track(reservationKey, tokenId, requester, PendingActionKind.CONFIRMATION);
    }

    public PendingAction registerPendingCancellation(Object reservationKey, Object tokenId, String requester) {
        return track(reservationKey, tokenId, requester, PendingActionKind.CANCELLATION);
    }

    private PendingAction track(Object reservationKey, Object tokenId, String requester, PendingActionKind kind) {
        ReservationKey key = ReservationKey.of(reservationKey);
        String who = requester != null ? requester : session.getIdentity().getAddress();
        return session.getPendingActions().track(key, tokenId, who, kind);
    }

    public List<PendingAction> pendingActions() {
        return session.getPendingActions().snapshot();
    }

    // ---- listing ----

    public void setOptimisticListing(Object labId, boolean listed, boolean pending) {
        session.getOptimisticState().setOptimisticListingState(labId, listed, pending);
    }

    public void completeOptimisticListing(Object labId) {
        session.getOptimisticState().completeOptimisticListingState(labId);
    }

    public void clearOptimisticListing(Object labId) {
        session.getOptimisticState().clearOptimisticListingState(labId);
    }

    public ListingState getEffectiveListing(Object labId, Boolean serverListed) {
        return session.getOptimisticState().getEffectiveListingState(labId, serverListed);
    }

    // ---- lab ----

    public void setOptimisticLab(Object labId, Map<String, Object> state) {
        session.getOptimisticState().setOptimisticLabState(labId, state);
    }

    public void clearOptimisticLab(Object labId) {
        session.getOptimisticState().clearOptimisticLabState(labId);
    }

    public Map<String, Object> getEffectiveLab(Object labId, Map<String, Object> serverState) {
        return session.getOptimisticState().getEffectiveLabState(labId, serverState);
    }

    // ---- booking ----

    public void setOptimisticBooking(Object reservationKey, Map<String, Object> state) {
        session.getOptimisticState().setOptimisticBookingState(reservationKey, state);
    }

    public void completeOptimisticBooking(Object reservationKey) {
        session.getOptimisticState().completeOptimisticBookingState(reservationKey);
    }

    public boolean clearOptimisticBooking(Object reservationKey) {
        return session.getOptimisticState().clearOptimisticBookingState(reservationKey);
    }

    /**
     * 链上详情 + 乐观覆盖层合并后的视图。
     */
    public Map<String, Object> getEffectiveBooking(Object reservationKey) {
        ReservationKey key = ReservationKey.of(reservationKey);
        ReservationRecord record = reservationReader.getReservation(key);
        OptimisticUiState optimistic = session.getOptimisticState();
        return optimistic.getEffectiveBookingState(key, toServerState(record));
    }

    public ReservationRecord getReservation(Object reservationKey) {
        return reservationReader.getReservation(ReservationKey.of(reservationKey));
    }

    public BookingsSnapshot fetchBookings(boolean force) {
        return listRefresher.fetchBookings(force);
    }

    public BookingsSnapshot refreshBookings() {
        return listRefresher.refresh();
    }

    public static Map<String, Object> toServerState(ReservationRecord record) {
        Map<String, Object> m = new LinkedHashMap<>();
        if (record == null || !record.exists()) {
            return m;
        }
        m.put("reservationKey", record.getReservationKey().value());
        m.put("tokenId", record.getTokenId());
        m.put("renter", record.getRenter());
        m.put("price", record.getPrice());
        m.put("start", record.getStart());
        m.put("end", record.getEnd());
        m.put("status", record.getStatus().name());
        m.put("statusCode", record.getStatusCode());
        return m;
    }
}
