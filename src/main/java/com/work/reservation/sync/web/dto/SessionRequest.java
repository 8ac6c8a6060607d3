package com.work.reservation.sync.web.dto;

import javax.validation.constraints.NotBlank;

public class SessionRequest {

    @NotBlank(message = "address 不能为空")
    private String address;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }
}
