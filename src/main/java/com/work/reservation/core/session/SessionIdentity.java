package com.work.reservation.core.session;

import com.work.reservation.core.support.LedgerValues;

/**
 * 当前会话的钱包地址。机构 SSO 会话可能没有地址（返回 null）。
 */
public class SessionIdentity {

    private volatile String address;

    public SessionIdentity() {
    }

    public SessionIdentity(String address) {
        this.address = LedgerValues.address(address);
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = LedgerValues.address(address);
    }

    public boolean isKnown() {
        return address != null;
    }

    public boolean matches(String other) {
        return LedgerValues.sameAddress(address, other);
    }
}
