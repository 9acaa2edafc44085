package com.mouse.smartbet.enums;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 1X2 match outcome. Declaration order is the canonical probability order
 * (home, away, draw) and also the arg-max tie-break priority.
 */
public enum Outcome {

    HOME("Home Win"),
    AWAY("Away Win"),
    DRAW("Draw");

    /** Tie-break priority used when two probabilities are equal. */
    public static final List<Outcome> PRIORITY = List.of(HOME, AWAY, DRAW);

    private final String label;

    Outcome(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<Outcome> fromCode(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        String c = code.trim().toUpperCase(Locale.ROOT);
        return switch (c) {
            case "HOME", "1", "HOME_WIN", "H" -> Optional.of(HOME);
            case "AWAY", "2", "AWAY_WIN", "A" -> Optional.of(AWAY);
            case "DRAW", "X", "D" -> Optional.of(DRAW);
            default -> Optional.empty();
        };
    }
}
