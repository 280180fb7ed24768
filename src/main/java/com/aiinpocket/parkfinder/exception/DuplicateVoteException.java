package com.aiinpocket.parkfinder.exception;

import lombok.Getter;

/**
 * 用戶已對此公園投過票。不會重試，直接回報給用戶。
 */
@Getter
public class DuplicateVoteException extends RuntimeException {

    private final Long parkId;
    private final String voterId;

    public DuplicateVoteException(Long parkId, String voterId) {
        super("你已經對這個公園投過票了");
        this.parkId = parkId;
        this.voterId = voterId;
    }

    public DuplicateVoteException(Long parkId, String voterId, Throwable cause) {
        super("你已經對這個公園投過票了", cause);
        this.parkId = parkId;
        this.voterId = voterId;
    }
}
