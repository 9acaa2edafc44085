package com.mouse.smartbet.enums;

public enum PlacementVerdict {
    ALLOWED,
    INVALID_STAKE,
    INSUFFICIENT_BANKROLL,
    MAX_STAKE_EXCEEDED,
    DAILY_LOSS_LIMIT,
    WEEKLY_LOSS_LIMIT;

    public boolean isAllowed() {
        return this == ALLOWED;
    }
}
