package com.mouse.smartbet.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum StakingStrategy {

    KELLY("kelly"),
    KELLY_FRACTIONAL("kelly_fractional"),
    FIXED_PERCENTAGE("fixed_percentage"),
    FIXED_AMOUNT("fixed_amount"),
    CONFIDENCE_SCALED("confidence_scaled");

    private final String code;

    StakingStrategy(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isKelly() {
        return this == KELLY || this == KELLY_FRACTIONAL;
    }

    /**
     * Resolve a strategy by its code ("kelly_fractional") or constant name ("KELLY_FRACTIONAL").
     */
    public static Optional<StakingStrategy> fromCode(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        String c = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.code.equals(c))
                .findFirst();
    }
}
