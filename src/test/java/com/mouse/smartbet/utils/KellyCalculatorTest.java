package com.mouse.smartbet.utils;

import com.mouse.smartbet.exception.InvalidInputException;
import com.mouse.smartbet.model.KellyResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class KellyCalculatorTest {

    @Test
    void kelly_positiveEdgeBelowCap_scalesByFraction() {
        // b = 1.2: (1.2 * 0.55 - 0.45) / 1.2 = 0.175
        KellyResult k = KellyCalculator.kelly(0.55, 2.20, true, 0.25);

        assertThat(k.positiveEdge()).isTrue();
        assertThat(k.capped()).isFalse();
        assertThat(k.full()).isCloseTo(0.175, within(1e-12));
        assertThat(k.fractional()).isCloseTo(0.04375, within(1e-12));
        assertThat(k.reason()).isNull();
    }

    @Test
    void kelly_largeEdge_isCappedBeforeScaling() {
        // (1.2 * 0.65 - 0.35) / 1.2 = 0.35833.. capped at 0.25
        KellyResult k = KellyCalculator.kelly(0.65, 2.20, true, 0.25);

        assertThat(k.rawFull()).isCloseTo(0.358333, within(1e-6));
        assertThat(k.capped()).isTrue();
        assertThat(k.full()).isEqualTo(0.25);
        assertThat(k.fractional()).isCloseTo(0.0625, within(1e-12));
        assertThat(k.fractionalPercentage()).isCloseTo(6.25, within(1e-9));
    }

    @Test
    void kelly_notFractional_returnsFullAsStakeFraction() {
        KellyResult k = KellyCalculator.kelly(0.55, 2.20, false, 0.25);

        assertThat(k.fractional()).isEqualTo(k.full());
        assertThat(k.fractionUsed()).isEqualTo(1.0);
    }

    @ParameterizedTest
    @CsvSource({"0.40, 2.0", "0.50, 2.0", "0.30, 3.0", "0.10, 1.5"})
    void kelly_nonPositiveEdge_returnsZeroWithReason(double p, double odds) {
        KellyResult k = KellyCalculator.kelly(p, odds);

        assertThat(k.positiveEdge()).isFalse();
        assertThat(k.full()).isZero();
        assertThat(k.fractional()).isZero();
        assertThat(k.reason()).isEqualTo("non-positive edge");
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, 2.0, 0.25",
            "1.0, 2.0, 0.25",
            "-0.2, 2.0, 0.25",
            "0.6, 1.0, 0.25",
            "0.6, 0.5, 0.25",
            "0.6, 2.0, 0.0",
            "0.6, 2.0, 1.5",
            "NaN, 2.0, 0.25"
    })
    void kelly_invalidPreconditions_throwInvalidInput(double p, double odds, double fraction) {
        assertThatThrownBy(() -> KellyCalculator.kelly(p, odds, true, fraction))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void kelly_isMonotoneInEdgeAndBounded() {
        double odds = 2.5;
        double previous = -1;
        for (int i = 1; i < 100; i++) {
            double p = i / 100.0;
            KellyResult k = KellyCalculator.kelly(p, odds, false, 1.0);

            assertThat(k.full()).isBetween(0.0, KellyCalculator.MAX_KELLY);
            assertThat(k.full()).isGreaterThanOrEqualTo(previous);
            previous = k.full();
        }
    }
}
