package com.work.reservation.demo.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

public class MockRequestReservation {

    @NotBlank(message = "tokenId 不能为空")
    private String tokenId;

    @NotBlank(message = "renter 不能为空")
    private String renter;

    @NotNull(message = "start 不能为空")
    private Long start;

    @NotNull(message = "end 不能为空")
    private Long end;

    public String getTokenId() {
        return tokenId;
    }

    public void setTokenId(String tokenId) {
        this.tokenId = tokenId;
    }

    public String getRenter() {
        return renter;
    }

    public void setRenter(String renter) {
        this.renter = renter;
    }

    public Long getStart() {
        return start;
    }

    public void setStart(Long start) {
        this.start = start;
    }

    public Long getEnd() {
        return end;
    }

    public void setEnd(Long end) {
        this.end = end;
    }
}
