package com.mouse.smartbet.enums;

/**
 * Bettor risk appetite. Each profile supplies the account defaults used when a
 * bankroll is opened without explicit overrides.
 */
public enum RiskProfile {

    CONSERVATIVE(2.0, StakingStrategy.KELLY_FRACTIONAL, 0.125, 70.0, 0.05, 5.0, 15.0,
            "Safest approach with small stakes and high confidence requirements"),
    BALANCED(5.0, StakingStrategy.KELLY_FRACTIONAL, 0.25, 60.0, 0.02, 10.0, 25.0,
            "Balanced approach suitable for most bettors"),
    AGGRESSIVE(10.0, StakingStrategy.KELLY, 0.5, 55.0, 0.0, 20.0, 40.0,
            "Higher risk/reward for experienced bettors");

    private final double maxStakePercentage;
    private final StakingStrategy recommendedStrategy;
    private final double kellyFraction;
    private final double minConfidencePct;
    private final double minExpectedValue;
    private final double dailyLossLimitPct;
    private final double weeklyLossLimitPct;
    private final String description;

    RiskProfile(double maxStakePercentage, StakingStrategy recommendedStrategy, double kellyFraction,
                double minConfidencePct, double minExpectedValue, double dailyLossLimitPct,
                double weeklyLossLimitPct, String description) {
        this.maxStakePercentage = maxStakePercentage;
        this.recommendedStrategy = recommendedStrategy;
        this.kellyFraction = kellyFraction;
        this.minConfidencePct = minConfidencePct;
        this.minExpectedValue = minExpectedValue;
        this.dailyLossLimitPct = dailyLossLimitPct;
        this.weeklyLossLimitPct = weeklyLossLimitPct;
        this.description = description;
    }

    public double getMaxStakePercentage() {
        return maxStakePercentage;
    }

    public StakingStrategy getRecommendedStrategy() {
        return recommendedStrategy;
    }

    public double getKellyFraction() {
        return kellyFraction;
    }

    public double getMinConfidencePct() {
        return minConfidencePct;
    }

    public double getMinExpectedValue() {
        return minExpectedValue;
    }

    public double getDailyLossLimitPct() {
        return dailyLossLimitPct;
    }

    public double getWeeklyLossLimitPct() {
        return weeklyLossLimitPct;
    }

    public String getDescription() {
        return description;
    }
}
