package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.exception.InvalidOddsException;

/**
 * Decimal 1X2 odds as quoted by the odds provider.
 */
public record OddsTriple(double home, double draw, double away) {

    public static OddsTriple of(double home, double draw, double away) {
        return new OddsTriple(home, draw, away);
    }

    public double get(Outcome outcome) {
        return switch (outcome) {
            case HOME -> home;
            case AWAY -> away;
            case DRAW -> draw;
        };
    }

    public boolean isValid() {
        return isValidOdds(home) && isValidOdds(draw) && isValidOdds(away);
    }

    /**
     * @throws InvalidOddsException if any price is not a finite number above 1.0
     */
    public OddsTriple validate() {
        if (!isValid()) {
            throw new InvalidOddsException(String.format(
                    "Odds must be > 1.0: home=%s, draw=%s, away=%s", home, draw, away));
        }
        return this;
    }

    public static boolean isValidOdds(double odds) {
        return Double.isFinite(odds) && odds > 1.0;
    }
}
