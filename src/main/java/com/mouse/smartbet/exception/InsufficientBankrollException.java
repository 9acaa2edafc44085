package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.ErrorCode;

import java.math.BigDecimal;

public class InsufficientBankrollException extends SmartBetException {

    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientBankrollException(BigDecimal requested, BigDecimal available) {
        super(ErrorCode.INSUFFICIENT_BANKROLL,
                "Insufficient bankroll: requested=" + requested + ", available=" + available);
        this.requested = requested;
        this.available = available;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
