package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.utils.OddsMath;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs for a stake recommendation, taken either from a gate decision or supplied raw.
 */
@Value
@Builder
public class StakeRequest {
    String predictionId;
    String leagueKey;
    String matchDescription;
    Outcome outcome;
    /** model win probability for the outcome, in (0, 1) */
    double winProbability;
    double odds;
    /** 0..100 */
    double confidencePct;
    double expectedValue;
    /** null when there was no gate decision */
    Boolean recommendedByGate;

    public static StakeRequest fromPrediction(PredictionRecord prediction) {
        return StakeRequest.builder()
                .predictionId(prediction.getPredictionId())
                .leagueKey(prediction.getLeagueKey())
                .matchDescription(prediction.getHomeTeam() + " vs " + prediction.getAwayTeam())
                .outcome(prediction.getOutcome())
                .winProbability(prediction.getConfidence())
                .odds(prediction.getSelectedOdds())
                .confidencePct(prediction.getConfidencePct())
                .expectedValue(prediction.getExpectedValue())
                .recommendedByGate(prediction.isRecommended())
                .build();
    }

    public static StakeRequest raw(Outcome outcome, double winProbability, double odds) {
        return StakeRequest.builder()
                .outcome(outcome)
                .winProbability(winProbability)
                .odds(odds)
                .confidencePct(winProbability * 100.0)
                .expectedValue(OddsMath.expectedValue(winProbability, odds))
                .build();
    }
}
