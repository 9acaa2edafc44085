package com.mouse.smartbet.enums;

public enum ErrorCode {
    UNSUPPORTED_LEAGUE,
    INVALID_ODDS,
    INVALID_PROBABILITIES,
    INVALID_INPUT,
    INSUFFICIENT_BANKROLL,
    LIMIT_EXCEEDED,
    ALREADY_SETTLED,
    MODEL_LOAD_FAILURE,
    NOT_FOUND
}
