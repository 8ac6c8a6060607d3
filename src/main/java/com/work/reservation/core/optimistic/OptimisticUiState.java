package com.work.reservation.core.optimistic;

import com.work.reservation.core.model.ListingState;
import com.work.reservation.core.model.OptimisticEntry;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.support.ValidationUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * 乐观 UI 状态门面：lab 上架状态、lab 通用状态、预约状态三类覆盖层。
 *
 * 预约状态的 key 统一走 {@link ReservationKey} 规范化，保证与事件对账使用的是同一个 key。
 */
public class OptimisticUiState {

    public static final String OP_LISTING = "listing";
    public static final String OP_UNLISTING = "unlisting";

    private final OptimisticEntryStore<Boolean> listingStates;
    private final MergingOptimisticEntryStore labStates;
    private final MergingOptimisticEntryStore bookingStates;

    public OptimisticUiState(Clock clock) {
        this.listingStates = new OptimisticEntryStore<>("lab-listing", clock);
        this.labStates = new MergingOptimisticEntryStore("lab-state", clock);
        this.bookingStates = new MergingOptimisticEntryStore("booking", clock);
    }

    // ---- listing ----

    public void setOptimisticListingState(Object labId, boolean isListed, boolean isPending) {
        listingStates.set(ValidationUtils.requireEntityId(labId, "labId"), isListed, isPending, isListed ? OP_LISTING : OP_UNLISTING);
    }

    public void completeOptimisticListingState(Object labId) {
        listingStates.complete(labId == null ? null : String.valueOf(labId));
    }

    public void clearOptimisticListingState(Object labId) {
        listingStates.clear(labId == null ? null : String.valueOf(labId));
    }

    public ListingState getEffectiveListingState(Object labId, Boolean serverIsListed) {
        OptimisticEntry<Boolean> entry = listingStates.get(labId == null ? null : String.valueOf(labId));
        if (entry != null) {
            return new ListingState(Boolean.TRUE.equals(entry.getDesiredValue()), entry.isPending(), entry.getOperation());
        }
        return ListingState.fromServer(serverIsListed);
    }

    // ---- lab general state ----

    public void setOptimisticLabState(Object labId, Map<String, Object> state) {
        labStates.merge(ValidationUtils.requireEntityId(labId, "labId"), state);
    }

    public void clearOptimisticLabState(Object labId) {
        labStates.clear(labId == null ? null : String.valueOf(labId));
    }

    public Map<String, Object> getEffectiveLabState(Object labId, Map<String, Object> serverState) {
        return labStates.getEffectiveState(labId == null ? null : String.valueOf(labId), serverState);
    }

    // ---- booking ----

    public void setOptimisticBookingState(Object bookingKey, Map<String, Object> state) {
        bookingStates.merge(ReservationKey.of(bookingKey).value(), state);
    }

    public void completeOptimisticBookingState(Object bookingKey) {
        ReservationKey key = ReservationKey.ofNullable(bookingKey);
        if (key != null) {
            bookingStates.complete(key.value());
        }
    }

    public boolean clearOptimisticBookingState(Object bookingKey) {
        ReservationKey key = ReservationKey.ofNullable(bookingKey);
        return key != null && bookingStates.clear(key.value());
    }

    public Map<String, Object> getEffectiveBookingState(Object bookingKey, Map<String, Object> serverState) {
        ReservationKey key = ReservationKey.ofNullable(bookingKey);
        return bookingStates.getEffectiveState(key == null ? null : key.value(), serverState);
    }

    public boolean hasOptimisticBookingState(Object bookingKey) {
        ReservationKey key = ReservationKey.ofNullable(bookingKey);
        return key != null && bookingStates.contains(key.value());
    }

    /**
     * 对三类覆盖层做一次统一清理。
     */
    public int sweep(Duration pendingMaxAge, Duration completedMaxAge) {
        return listingStates.sweep(pendingMaxAge, completedMaxAge)
                + labStates.sweep(pendingMaxAge, completedMaxAge)
                + bookingStates.sweep(pendingMaxAge, completedMaxAge);
    }

    public int size() {
        return listingStates.size() + labStates.size() + bookingStates.size();
    }

    public void clearAll() {
        listingStates.clearAll();
        labStates.clearAll();
        bookingStates.clearAll();
    }
}
