package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.ErrorCode;

public class InvalidOddsException extends SmartBetException {

    public InvalidOddsException(String message) {
        super(ErrorCode.INVALID_ODDS, message);
    }

    public InvalidOddsException(String message, Throwable e) {
        super(ErrorCode.INVALID_ODDS, message, e);
    }
}
