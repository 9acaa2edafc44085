package com.mouse.smartbet.model;

/**
 * Kelly figures for one (probability, odds) pair. All fractions are of bankroll, not percentages.
 *
 * @param rawFull      uncapped Kelly fraction, may be negative
 * @param full         max(0, min(rawFull, 0.25))
 * @param fractional   full * fractionUsed (equals full when fractional sizing was not requested)
 * @param fractionUsed scaling factor applied to full
 * @param positiveEdge false when rawFull <= 0
 * @param capped       true when rawFull was above the ceiling
 * @param reason       null when positiveEdge, otherwise why the stake is zero
 */
public record KellyResult(double rawFull,
                          double full,
                          double fractional,
                          double fractionUsed,
                          boolean positiveEdge,
                          boolean capped,
                          String reason) {

    public double fullPercentage() {
        return full * 100.0;
    }

    public double fractionalPercentage() {
        return fractional * 100.0;
    }
}
