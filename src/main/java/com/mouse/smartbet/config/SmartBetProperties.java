package com.mouse.smartbet.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "smartbet")
@Data
@Validated
public class SmartBetProperties {

    @Valid
    private Gate gate = new Gate();

    @Valid
    private Staking staking = new Staking();

    @Valid
    private Ledger ledger = new Ledger();

    @Valid
    private Metrics metrics = new Metrics();

    @Data
    public static class Gate {
        /** Max |sum - 1| accepted before renormalizing a probability triple. */
        @Positive
        private double probabilityTolerance = 0.01;
    }

    @Data
    public static class Staking {
        /** Stake % used when the strategy code is not recognized. */
        @Positive
        private double fallbackPercentage = 2.0;

        @DecimalMin("0.01")
        @DecimalMax("1.0")
        private double defaultKellyFraction = 0.25;

        @Positive
        private double defaultFixedPercentage = 2.0;

        @NotNull
        private BigDecimal defaultFixedAmount = new BigDecimal("10.00");

        // confidence_scaled: confidence [floor, ceiling] % maps linearly to stake [min, max] %
        private double confidenceFloorPct = 55.0;
        private double confidenceCeilingPct = 100.0;
        private double minConfidenceStakePct = 1.0;
        private double maxConfidenceStakePct = 5.0;
    }

    @Data
    public static class Ledger {
        @NotNull
        private Duration dailyWindow = Duration.ofDays(1);

        @NotNull
        private Duration weeklyWindow = Duration.ofDays(7);

        /** Warn when a stake uses more than this share of the remaining daily loss allowance. */
        private double dailyAllowanceWarningShare = 0.5;

        private double weeklyAllowanceWarningShare = 0.3;

        /** Warn when a single stake exceeds this % of current bankroll. */
        private double singleBetWarningPct = 10.0;

        /** Warn when current bankroll falls below this ratio of the initial bankroll. */
        private double drawdownWarningRatio = 0.7;
    }

    @Data
    public static class Metrics {
        /** Placement refusal rate (%) above which the periodic snapshot logs a warning. */
        private double refusalWarningRate = 20.0;
    }
}
