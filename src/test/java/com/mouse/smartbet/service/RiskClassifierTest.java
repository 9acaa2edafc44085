package com.mouse.smartbet.service;

import com.mouse.smartbet.enums.RiskLevel;
import com.mouse.smartbet.model.RiskAssessment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class RiskClassifierTest {

    private final RiskClassifier classifier = new RiskClassifier();

    @Test
    void classify_conservativeBet_isLow() {
        RiskAssessment r = classifier.classify(2.0, 75.0, 1.80, 0.10);

        assertThat(r.getLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(r.getScore()).isZero();
        assertThat(r.getFactors()).isEmpty();
        assertThat(r.getExplanation()).isEqualTo("Low risk bet: Conservative stake, high confidence, good odds");
    }

    @Test
    void classify_moderateStakeAndConfidence_isMedium() {
        RiskAssessment r = classifier.classify(4.0, 65.0, 1.80, 0.10);

        assertThat(r.getLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(r.getScore()).isEqualTo(2);
        assertThat(r.getFactors()).hasSize(2);
        assertThat(r.getFactors().get(0)).startsWith("Moderate stake");
        assertThat(r.getFactors().get(1)).startsWith("Moderate confidence");
        assertThat(r.getExplanation()).startsWith("Medium risk bet: Moderate stake");
    }

    @Test
    void classify_everyRuleFiring_isHighWithAllFactors() {
        RiskAssessment r = classifier.classify(6.0, 58.0, 3.50, 0.01);

        assertThat(r.getLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(r.getScore()).isEqualTo(7);
        assertThat(r.getFactors()).hasSize(4);
        assertThat(r.getFactors()).last().isEqualTo("Small edge vs market");
        assertThat(r.getExplanation()).startsWith("High risk bet: Large stake");
    }

    @ParameterizedTest
    @CsvSource({
            // stake%, confidence%, odds, edge, expected score
            "5.0, 70.0, 2.0, 0.05, 1",
            "3.0, 60.0, 2.0, 0.05, 1",
            "3.0, 70.0, 3.0, 0.05, 1",
            "3.0, 70.0, 2.0, 0.049, 1",
            "5.01, 70.0, 2.0, 0.05, 2",
            "3.0, 59.9, 2.01, 0.05, 3",
            "3.0, 70.0, 3.01, 0.05, 2"
    })
    void classify_thresholdsAreStrict(double stakePct, double confidencePct, double odds, double edge, int expectedScore) {
        assertThat(classifier.classify(stakePct, confidencePct, odds, edge).getScore()).isEqualTo(expectedScore);
    }

    @Test
    void classify_scoreThreeIsHigh() {
        RiskAssessment r = classifier.classify(4.0, 58.0, 1.80, 0.10);

        assertThat(r.getScore()).isEqualTo(3);
        assertThat(r.getLevel()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void classifyProbability_derivesConfidenceAndEdgeFromProbability() {
        // confidence 70%, edge 0.70 - 1/1.8 = 0.144
        RiskAssessment r = classifier.classifyProbability(2.0, 0.70, 1.80);

        assertThat(r.getLevel()).isEqualTo(RiskLevel.LOW);

        // confidence 52%, edge 0.52 - 0.5 = 0.02
        RiskAssessment weak = classifier.classifyProbability(2.0, 0.52, 2.0);
        assertThat(weak.getScore()).isEqualTo(3);
        assertThat(weak.getFactors()).contains("Small edge vs market");
    }
}
