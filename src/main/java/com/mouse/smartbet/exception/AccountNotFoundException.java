package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.ErrorCode;

public class AccountNotFoundException extends SmartBetException {

    public AccountNotFoundException(Long accountId) {
        super(ErrorCode.NOT_FOUND, "No bankroll account found for id: " + accountId);
    }
}
