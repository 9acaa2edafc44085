package com.mouse.smartbet.enums;

public enum RiskLevel {

    /** No stake recommended, nothing to classify */
    NONE,

    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel fromScore(int score) {
        if (score <= 0) return LOW;
        if (score <= 2) return MEDIUM;
        return HIGH;
    }
}
