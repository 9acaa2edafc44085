package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.ModelStatus;
import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.enums.RecommendationReason;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one prediction call. Created once, never modified.
 */
@Value
@Builder(toBuilder = true)
public class PredictionRecord {
    String predictionId;
    String matchId;
    String homeTeam;
    String awayTeam;
    String leagueKey;

    ProbabilityTriple probabilities;
    OddsTriple odds;

    Outcome outcome;
    /** max(probabilities) */
    double confidence;
    double selectedOdds;
    /** confidence * selectedOdds - 1 */
    double expectedValue;

    boolean recommended;
    RecommendationReason reason;

    double confidenceThreshold;
    double oddsThreshold;
    ModelStatus modelStatus;

    @Singular
    List<String> alerts;

    /** Plain-language reasoning behind the predicted outcome. */
    String explanation;

    /** Formatted match facts from the league adapter, in display order. */
    @Singular
    Map<String, String> insights;

    Instant createdAt;

    public boolean isEvPositive() {
        return expectedValue > 0;
    }

    public double getConfidencePct() {
        return confidence * 100.0;
    }
}
