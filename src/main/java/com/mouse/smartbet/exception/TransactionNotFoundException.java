package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.ErrorCode;

public class TransactionNotFoundException extends SmartBetException {

    public TransactionNotFoundException(Long transactionId) {
        super(ErrorCode.NOT_FOUND, "No bet transaction found for id: " + transactionId);
    }
}
