package com.mouse.smartbet.service;

import com.mouse.smartbet.exception.SmartBetException;
import com.mouse.smartbet.exception.UnsupportedLeagueException;
import com.mouse.smartbet.league.LeagueRegistry;
import com.mouse.smartbet.model.BatchPredictionResult;
import com.mouse.smartbet.model.LeagueProfile;
import com.mouse.smartbet.model.MatchAttributes;
import com.mouse.smartbet.model.MatchInsights;
import com.mouse.smartbet.model.PredictionRecord;
import com.mouse.smartbet.model.ProbabilityTriple;
import com.mouse.smartbet.predictor.ModelRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * name -> LeagueRegistry -> ModelRouter -> PredictionGate, then the league adapter's insights
 * and a written explanation are attached.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PredictionService {

    private final LeagueRegistry leagueRegistry;
    private final ModelRouter modelRouter;
    private final PredictionGate predictionGate;
    private final PredictionExplainer predictionExplainer;
    private final EngineMetricsService metricsService;

    /**
     * @throws UnsupportedLeagueException if the name does not resolve to a registered league
     */
    public PredictionRecord predict(String leagueName, Map<String, ?> rawAttributes) {
        LeagueProfile profile = resolve(leagueName);
        return predict(profile, MatchAttributes.fromMap(rawAttributes));
    }

    public PredictionRecord predict(String leagueName, MatchAttributes match) {
        return predict(resolve(leagueName), match);
    }

    /**
     * Predict every match independently. Each map carries its league under {@code "league"}.
     * Domain failures are collected per match, the rest of the batch still runs.
     */
    public BatchPredictionResult predictBatch(List<? extends Map<String, ?>> matches) {
        BatchPredictionResult.BatchPredictionResultBuilder result = BatchPredictionResult.builder();
        for (int i = 0; i < matches.size(); i++) {
            Map<String, ?> raw = matches.get(i);
            Object league = raw == null ? null : raw.get(MatchAttributes.LEAGUE);
            String leagueName = league == null ? null : league.toString();
            try {
                result.prediction(predict(leagueName, raw));
            } catch (SmartBetException e) {
                log.warn("Batch item {} [{}] failed: {} - {}", i, leagueName, e.getErrorCode(), e.getMessage());
                result.failure(new BatchPredictionResult.Failure(i, leagueName, describe(raw), e.getErrorCode(), e.getMessage()));
            }
        }
        BatchPredictionResult built = result.build();
        log.info("🔮 Batch prediction | Total: {} | Predicted: {} | Unsupported: {} | Failed: {} | Recommended: {}",
                built.getTotal(), built.getPredictions().size(), built.getUnsupportedCount(),
                built.getFailures().size() - built.getUnsupportedCount(), built.getRecommendedCount());
        return built;
    }

    private PredictionRecord predict(LeagueProfile profile, MatchAttributes match) {
        String key = profile.getKey();
        try {
            match.getOdds().validate();
            ProbabilityTriple probabilities = modelRouter.predict(key, match);
            PredictionRecord decided = predictionGate.decide(probabilities, match.getOdds(), profile);

            PredictionRecord identified = decided.toBuilder()
                    .matchId(match.matchIdOrDefault())
                    .homeTeam(match.getHomeTeam())
                    .awayTeam(match.getAwayTeam())
                    .build();

            MatchInsights insights = profile.getFeatureAdapter().insights(match);
            PredictionRecord record = identified.toBuilder()
                    .alerts(insights.getAlerts())
                    .insights(predictionExplainer.insightMap(identified, insights))
                    .explanation(predictionExplainer.explain(identified, insights))
                    .build();

            log.debug("Explanation [{}] {}: {}", key, match.description(), record.getExplanation());
            metricsService.recordPrediction(record.isRecommended());
            log.info("🔮 Prediction | League: {} | Match: {} | Outcome: {} | Confidence: {}% | Odds: {} | EV: {} | Decision: {}",
                    key, match.description(), record.getOutcome(), String.format("%.1f", record.getConfidencePct()),
                    record.getSelectedOdds(), String.format("%.4f", record.getExpectedValue()), record.getReason());
            return record;
        } catch (SmartBetException e) {
            metricsService.recordPredictionFailure();
            throw e;
        }
    }

    private LeagueProfile resolve(String leagueName) {
        try {
            return leagueRegistry.resolveProfile(leagueName);
        } catch (UnsupportedLeagueException e) {
            metricsService.recordUnsupportedLeague();
            log.warn("Unsupported league requested: '{}'", leagueName);
            throw e;
        }
    }

    private static String describe(Map<String, ?> raw) {
        if (raw == null) return null;
        return raw.get(MatchAttributes.HOME_TEAM) + " vs " + raw.get(MatchAttributes.AWAY_TEAM);
    }
}
