package com.mouse.smartbet.utils;

import com.mouse.smartbet.model.OddsTriple;

/**
 * Market arithmetic on decimal odds.
 */
public final class OddsMath {

    private OddsMath() {
    }

    /** 1 / odds: the market's probability before margin removal. */
    public static double impliedProbability(double decimalOdds) {
        return 1.0 / decimalOdds;
    }

    public static double overround(OddsTriple odds) {
        return impliedProbability(odds.home()) + impliedProbability(odds.draw()) + impliedProbability(odds.away());
    }

    /** Sum of implied probabilities minus 1. */
    public static double bookmakerMargin(OddsTriple odds) {
        return overround(odds) - 1.0;
    }

    public static double marketEfficiency(OddsTriple odds) {
        return 1.0 / overround(odds);
    }

    /** Model probability minus the market's implied probability. */
    public static double edge(double probability, double decimalOdds) {
        return probability - impliedProbability(decimalOdds);
    }

    /** confidence * odds - 1 */
    public static double expectedValue(double probability, double decimalOdds) {
        return probability * decimalOdds - 1.0;
    }

    public static double populationStdDev(double... values) {
        double mean = 0;
        for (double v : values) mean += v;
        mean /= values.length;
        double sq = 0;
        for (double v : values) sq += (v - mean) * (v - mean);
        return Math.sqrt(sq / values.length);
    }
}
