package com.mouse.smartbet.service;

import com.mouse.smartbet.config.SmartBetProperties;
import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.enums.RecommendationReason;
import com.mouse.smartbet.exception.InvalidProbabilitiesException;
import com.mouse.smartbet.model.LeagueProfile;
import com.mouse.smartbet.model.OddsTriple;
import com.mouse.smartbet.model.PredictionRecord;
import com.mouse.smartbet.model.ProbabilityTriple;
import com.mouse.smartbet.utils.OddsMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns class probabilities and market odds into a bet/skip decision for one league.
 *
 * outcome    = arg-max of probabilities, ties resolved home, away, draw
 * confidence = probability of that outcome
 * EV         = confidence * odds(outcome) - 1
 * recommend  = confidence >= league confidence threshold AND odds(outcome) >= league odds threshold
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PredictionGate {

    private final SmartBetProperties properties;
    private final Clock clock;

    /**
     * @throws com.mouse.smartbet.exception.InvalidOddsException if any price is <= 1.0
     * @throws InvalidProbabilitiesException if the triple is negative, non-finite or does not sum to ~1
     */
    public PredictionRecord decide(ProbabilityTriple probabilities, OddsTriple odds, LeagueProfile profile) {
        odds.validate();
        ProbabilityTriple p = sanitize(probabilities);

        Outcome outcome = p.argMax();
        double confidence = p.get(outcome);
        double selectedOdds = odds.get(outcome);
        double ev = OddsMath.expectedValue(confidence, selectedOdds);

        boolean meetsConfidence = confidence >= profile.getConfidenceThreshold();
        boolean meetsOdds = selectedOdds >= profile.getOddsThreshold();
        RecommendationReason reason = RecommendationReason.of(meetsConfidence, meetsOdds);

        PredictionRecord record = PredictionRecord.builder()
                .predictionId(UUID.randomUUID().toString())
                .leagueKey(profile.getKey())
                .probabilities(p)
                .odds(odds)
                .outcome(outcome)
                .confidence(confidence)
                .selectedOdds(selectedOdds)
                .expectedValue(ev)
                .recommended(reason.isRecommended())
                .reason(reason)
                .confidenceThreshold(profile.getConfidenceThreshold())
                .oddsThreshold(profile.getOddsThreshold())
                .modelStatus(profile.getStatus())
                .alerts(alerts(ev, confidence))
                .createdAt(clock.instant())
                .build();

        log.debug("Gate [{}]: outcome={} confidence={} odds={} ev={} -> {}",
                profile.getKey(), outcome, confidence, selectedOdds, ev, reason);
        return record;
    }

    private ProbabilityTriple sanitize(ProbabilityTriple p) {
        if (p == null || !p.isFinite() || p.hasNegative()) {
            throw new InvalidProbabilitiesException("Probabilities must be finite and non-negative: " + p);
        }
        double sum = p.sum();
        double tolerance = properties.getGate().getProbabilityTolerance();
        if (Math.abs(sum - 1.0) > tolerance) {
            throw new InvalidProbabilitiesException(String.format(
                    "Probabilities sum to %.6f, expected 1 +/- %s: %s", sum, tolerance, p));
        }
        return p.normalized();
    }

    private List<String> alerts(double ev, double confidence) {
        List<String> alerts = new ArrayList<>();
        if (ev > 0.15) {
            alerts.add("Excellent value bet opportunity");
        } else if (ev > 0.05) {
            alerts.add("Good betting value detected");
        } else if (ev < -0.10) {
            alerts.add("Poor value - odds too low");
        }
        if (confidence > 0.80) {
            alerts.add("Very high model confidence");
        } else if (confidence < 0.55) {
            alerts.add("Low confidence prediction");
        }
        return alerts;
    }
}
