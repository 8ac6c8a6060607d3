package com.work.reservation.sync.web.dto;

/**
 * 登记在途动作。requester 不传时使用会话地址。
 */
public class PendingActionRequest {

    private String tokenId;

    private String requester;

    public String getTokenId() {
        return tokenId;
    }

    public void setTokenId(String tokenId) {
        this.tokenId = tokenId;
    }

    public String getRequester() {
        return requester;
    }

    public void setRequester(String requester) {
        this.requester = requester;
    }
}
