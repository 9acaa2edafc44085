package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.BetStatus;
import com.mouse.smartbet.enums.ErrorCode;

public class AlreadySettledException extends SmartBetException {

    private final Long transactionId;
    private final BetStatus currentStatus;

    public AlreadySettledException(Long transactionId, BetStatus currentStatus) {
        super(ErrorCode.ALREADY_SETTLED,
                "Transaction " + transactionId + " is already " + currentStatus);
        this.transactionId = transactionId;
        this.currentStatus = currentStatus;
    }

    public Long getTransactionId() {
        return transactionId;
    }

    public BetStatus getCurrentStatus() {
        return currentStatus;
    }
}
