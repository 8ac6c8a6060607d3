package com.work.reservation.sync.web.dto;

import javax.validation.constraints.NotNull;

public class ListingRequest {

    @NotNull(message = "listed 不能为空")
    private Boolean listed;

    private boolean pending = true;

    public Boolean getListed() {
        return listed;
    }

    public void setListed(Boolean listed) {
        this.listed = listed;
    }

    public boolean isPending() {
        return pending;
    }

    public void setPending(boolean pending) {
        this.pending = pending;
    }
}
