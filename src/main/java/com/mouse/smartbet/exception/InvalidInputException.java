package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.ErrorCode;

public class InvalidInputException extends SmartBetException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable e) {
        super(ErrorCode.INVALID_INPUT, message, e);
    }
}
