package com.work.reservation.core.model;

import java.util.Objects;

/**
 * lab 上架状态的有效视图（乐观覆盖或服务端值）。
 */
public class ListingState {

    private final boolean listed;
    private final boolean pending;
    private final String operation;

    public ListingState(boolean listed, boolean pending, String operation) {
        this.listed = listed;
        this.pending = pending;
        this.operation = operation;
    }

    public static ListingState fromServer(Boolean serverIsListed) {
        return new ListingState(Boolean.TRUE.equals(serverIsListed), false, null);
    }

    public boolean isListed() {
        return listed;
    }

    public boolean isPending() {
        return pending;
    }

    /**
     * "listing" / "unlisting"；服务端值时为 null。
     */
    public String getOperation() {
        return operation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ListingState)) {
            return false;
        }
        ListingState that = (ListingState) o;
        return listed == that.listed && pending == that.pending && Objects.equals(operation, that.operation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(listed, pending, operation);
    }

    @Override
    public String toString() {
        return "ListingState{isListed=" + listed + ", isPending=" + pending + ", operation=" + operation + '}';
    }
}
