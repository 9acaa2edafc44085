package com.mouse.smartbet.enums;

public enum BetStatus {

    /**
     * Stake debited, waiting for the match result
     */
    PENDING,

    /**
     * Bet won, stake plus winnings credited
     */
    SETTLED_WON,

    /**
     * Bet lost, nothing credited
     */
    SETTLED_LOST,

    /**
     * Bet voided, stake refunded
     */
    VOID;

    public boolean isFinal() {
        return this != PENDING;
    }

    /** Only PENDING may move, and only to a final state. */
    public boolean canTransitionTo(BetStatus next) {
        return this == PENDING && next != null && next.isFinal();
    }
}
