package com.mouse.smartbet.utils;

import com.mouse.smartbet.exception.InvalidInputException;
import com.mouse.smartbet.model.KellyResult;

public final class KellyCalculator {

    /** Ceiling applied to full Kelly before any fractional scaling. */
    public static final double MAX_KELLY = 0.25;

    /** Quarter Kelly. */
    public static final double DEFAULT_FRACTION = 0.25;

    public static final String NON_POSITIVE_EDGE = "non-positive edge";

    private KellyCalculator() {
    }

    /**
     * Kelly stake as a fraction of bankroll.
     * Formula: f = (b * p - q) / b, with b = odds - 1 and q = 1 - p
     *
     * @param p           model win probability, strictly inside (0, 1)
     * @param decimalOdds decimal odds, strictly above 1.0
     * @param fractional  scale full Kelly by {@code fraction} when true
     * @param fraction    scaling factor in (0, 1]
     * @throws InvalidInputException if any precondition fails
     */
    public static KellyResult kelly(double p, double decimalOdds, boolean fractional, double fraction) {
        if (!(p > 0.0 && p < 1.0)) {
            throw new InvalidInputException("Win probability must be in (0, 1), got " + p);
        }
        if (!(decimalOdds > 1.0) || Double.isInfinite(decimalOdds)) {
            throw new InvalidInputException("Decimal odds must be > 1.0, got " + decimalOdds);
        }
        if (!(fraction > 0.0 && fraction <= 1.0)) {
            throw new InvalidInputException("Kelly fraction must be in (0, 1], got " + fraction);
        }

        double b = decimalOdds - 1.0;
        double q = 1.0 - p;
        double raw = (b * p - q) / b;
        double used = fractional ? fraction : 1.0;

        if (!(raw > 0.0)) {
            return new KellyResult(raw, 0.0, 0.0, used, false, false, NON_POSITIVE_EDGE);
        }

        boolean capped = raw > MAX_KELLY;
        double full = Math.min(raw, MAX_KELLY);
        double scaled = full * used;

        return new KellyResult(raw, full, scaled, used, true, capped, null);
    }

    public static KellyResult kelly(double p, double decimalOdds) {
        return kelly(p, decimalOdds, true, DEFAULT_FRACTION);
    }

    /** Kelly edge b * p - (1 - p); Kelly output is non-decreasing in it for fixed odds. */
    public static double kellyEdge(double p, double decimalOdds) {
        return (decimalOdds - 1.0) * p - (1.0 - p);
    }
}
