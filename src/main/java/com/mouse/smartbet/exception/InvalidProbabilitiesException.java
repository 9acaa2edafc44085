package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.ErrorCode;

public class InvalidProbabilitiesException extends SmartBetException {

    public InvalidProbabilitiesException(String message) {
        super(ErrorCode.INVALID_PROBABILITIES, message);
    }

    public InvalidProbabilitiesException(String message, Throwable e) {
        super(ErrorCode.INVALID_PROBABILITIES, message, e);
    }
}
