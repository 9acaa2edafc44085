package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.ErrorCode;
import com.mouse.smartbet.enums.PlacementVerdict;

public class LimitExceededException extends SmartBetException {

    private final PlacementVerdict verdict;

    public LimitExceededException(PlacementVerdict verdict, String message) {
        super(ErrorCode.LIMIT_EXCEEDED, message);
        this.verdict = verdict;
    }

    public PlacementVerdict getVerdict() {
        return verdict;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
