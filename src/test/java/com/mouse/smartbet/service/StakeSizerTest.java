package com.mouse.smartbet.service;

import com.mouse.smartbet.config.SmartBetProperties;
import com.mouse.smartbet.enums.RiskLevel;
import com.mouse.smartbet.exception.InvalidInputException;
import com.mouse.smartbet.exception.InvalidOddsException;
import com.mouse.smartbet.model.StakeParams;
import com.mouse.smartbet.model.StakeSizing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StakeSizerTest {

    static final BigDecimal BANKROLL = new BigDecimal("1000.00");

    StakeSizer sizer;

    @BeforeEach
    void setUp() {
        sizer = new StakeSizer(new SmartBetProperties(), new RiskClassifier());
    }

    @Test
    void size_halfKellyAboveCap_isClampedWithWarning() {
        // raw Kelly (1 * 0.58 - 0.42) / 1 = 0.16, half = 0.08 -> $80, cap 5% -> $50
        StakeSizing s = sizer.size(BANKROLL, "kelly_fractional", 0.58, 2.0, 58.0,
                StakeParams.builder().kellyFraction(0.5).build(), 5.0);

        assertThat(s.getRawStake()).isEqualByComparingTo("80.00");
        assertThat(s.getStakeAmount()).isEqualByComparingTo("50.00");
        assertThat(s.getMaxStakeAllowed()).isEqualByComparingTo("50.00");
        assertThat(s.isClamped()).isTrue();
        assertThat(s.getWarnings()).containsExactly("Stake reduced from $80.00 to $50.00 (max 5.0% limit)");
        assertThat(s.getStakePercentage()).isCloseTo(5.0, within(1e-9));
        assertThat(s.getKelly().fractionUsed()).isEqualTo(0.5);
        // stake 5% +1, confidence 58% +2
        assertThat(s.getRisk().getLevel()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void size_quarterKellyUnderCap_hasNoWarnings() {
        // full 0.175, quarter 0.04375 -> $43.75
        StakeSizing s = sizer.size(BANKROLL, "kelly_fractional", 0.55, 2.2, 55.0, StakeParams.defaults(), 5.0);

        assertThat(s.getStakeAmount()).isEqualByComparingTo("43.75");
        assertThat(s.isClamped()).isFalse();
        assertThat(s.getWarnings()).isEmpty();
        assertThat(s.getKelly().fractionUsed()).isEqualTo(0.25);
        assertThat(s.hasStake()).isTrue();
    }

    @Test
    void size_fullKelly_warnsAboutAggressiveness() {
        StakeSizing s = sizer.size(BANKROLL, "kelly", 0.55, 2.2, 55.0, StakeParams.defaults(), 25.0);

        assertThat(s.getStakeAmount()).isEqualByComparingTo("175.00");
        assertThat(s.getWarnings()).containsExactly("Full Kelly is aggressive - consider Fractional Kelly");
    }

    @Test
    void size_noEdge_returnsZeroStakeAndNoRisk() {
        StakeSizing s = sizer.size(BANKROLL, "kelly_fractional", 0.40, 2.0, 40.0, StakeParams.defaults(), 5.0);

        assertThat(s.getStakeAmount()).isEqualByComparingTo("0");
        assertThat(s.hasStake()).isFalse();
        assertThat(s.getWarnings()).containsExactly("non-positive edge");
        assertThat(s.getRisk().getLevel()).isEqualTo(RiskLevel.NONE);
        assertThat(s.getKelly().positiveEdge()).isFalse();
    }

    @Test
    void size_fixedPercentage_usesParamOrDefault() {
        assertThat(sizer.size(BANKROLL, "fixed_percentage", 0.6, 2.0, 60.0, StakeParams.defaults(), 5.0)
                .getStakeAmount()).isEqualByComparingTo("20.00");
        assertThat(sizer.size(BANKROLL, "fixed_percentage", 0.6, 2.0, 60.0,
                StakeParams.builder().fixedPercentage(3.0).build(), 5.0)
                .getStakeAmount()).isEqualByComparingTo("30.00");
    }

    @Test
    void size_fixedAmount_roundsToCentsAndIgnoresEdge() {
        StakeSizing s = sizer.size(BANKROLL, "fixed_amount", 0.30, 2.0, 30.0,
                StakeParams.builder().fixedAmount(new BigDecimal("12.345")).build(), 5.0);

        assertThat(s.getStakeAmount()).isEqualByComparingTo("12.35");
        assertThat(s.getKelly()).isNull();
    }

    @Test
    void size_negativeFixedSettings_throwInsteadOfNegativeStake() {
        assertThatThrownBy(() -> sizer.size(BANKROLL, "fixed_amount", 0.6, 2.0, 60.0,
                StakeParams.builder().fixedAmount(new BigDecimal("-25")).build(), 5.0))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Fixed stake amount must not be negative, got -25");
        assertThatThrownBy(() -> sizer.size(BANKROLL, "fixed_percentage", 0.6, 2.0, 60.0,
                StakeParams.builder().fixedPercentage(-3.0).build(), 5.0))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Fixed stake percentage must not be negative, got -3.0");
    }

    @Test
    void size_zeroFixedAmount_isZeroStakeWithNoRisk() {
        StakeSizing s = sizer.size(BANKROLL, "fixed_amount", 0.6, 2.0, 60.0,
                StakeParams.builder().fixedAmount(BigDecimal.ZERO).build(), 5.0);

        assertThat(s.hasStake()).isFalse();
        assertThat(s.getRisk().getLevel()).isEqualTo(RiskLevel.NONE);
    }

    @Test
    void size_confidenceScaled_mapsConfidenceLinearly() {
        StakeSizing s = sizer.size(BANKROLL, "confidence_scaled", 0.775, 2.0, 77.5, StakeParams.defaults(), 5.0);

        assertThat(s.getStakeAmount()).isEqualByComparingTo("30.00");
    }

    @Test
    void size_confidenceScaledBelowFloor_returnsZero() {
        StakeSizing s = sizer.size(BANKROLL, "confidence_scaled", 0.50, 2.5, 50.0, StakeParams.defaults(), 5.0);

        assertThat(s.hasStake()).isFalse();
        assertThat(s.getWarnings()).containsExactly("Confidence too low for betting");
    }

    @ParameterizedTest
    @CsvSource({"55.0, 1.0", "77.5, 3.0", "100.0, 5.0", "120.0, 5.0", "54.9, 0.0"})
    void confidenceScaledPercentage_boundaries(double confidencePct, double expectedPct) {
        assertThat(sizer.confidenceScaledPercentage(confidencePct)).isCloseTo(expectedPct, within(1e-9));
    }

    @Test
    void size_unknownStrategy_fallsBackToFixedTwoPercent() {
        StakeSizing s = sizer.size(BANKROLL, "martingale", 0.6, 2.0, 60.0, StakeParams.defaults(), 5.0);

        assertThat(s.isFallbackApplied()).isTrue();
        assertThat(s.getStakeAmount()).isEqualByComparingTo("20.00");
        assertThat(s.getWarnings()).containsExactly("Unknown staking strategy 'martingale' - using fixed 2.0% fallback");
    }

    @Test
    void size_strategyConstantName_isAccepted() {
        StakeSizing s = sizer.size(BANKROLL, "FIXED_PERCENTAGE", 0.6, 2.0, 60.0, StakeParams.defaults(), 5.0);

        assertThat(s.isFallbackApplied()).isFalse();
        assertThat(s.getStakeAmount()).isEqualByComparingTo("20.00");
    }

    @Test
    void size_emptyBankroll_returnsZero() {
        StakeSizing s = sizer.size(BigDecimal.ZERO, "fixed_percentage", 0.6, 2.0, 60.0, StakeParams.defaults(), 5.0);

        assertThat(s.hasStake()).isFalse();
        assertThat(s.getWarnings()).containsExactly("No bankroll available");
    }

    @Test
    void size_neverExceedsMaxStake() {
        for (String code : new String[]{"kelly", "kelly_fractional", "fixed_percentage", "confidence_scaled"}) {
            StakeSizing s = sizer.size(BANKROLL, code, 0.9, 3.0, 90.0,
                    StakeParams.builder().fixedPercentage(20.0).build(), 2.5);
            assertThat(s.getStakeAmount()).isLessThanOrEqualTo(s.getMaxStakeAllowed());
            assertThat(s.getMaxStakeAllowed()).isEqualByComparingTo("25.00");
        }
    }

    @Test
    void size_invalidOddsOrCap_throws() {
        assertThatThrownBy(() -> sizer.size(BANKROLL, "kelly", 0.6, 1.0, 60.0, null, 5.0))
                .isInstanceOf(InvalidOddsException.class);
        assertThatThrownBy(() -> sizer.size(BANKROLL, "kelly", 0.6, 2.0, 60.0, null, 0.0))
                .isInstanceOf(InvalidInputException.class);
    }
}
