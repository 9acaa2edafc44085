package com.mouse.smartbet.service;

import com.mouse.smartbet.config.SmartBetProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
@RequiredArgsConstructor
public class EngineMetricsService {

    private final SmartBetProperties properties;

    private final AtomicInteger predictions = new AtomicInteger(0);
    private final AtomicInteger recommended = new AtomicInteger(0);
    private final AtomicInteger skipped = new AtomicInteger(0);
    private final AtomicInteger unsupportedLeague = new AtomicInteger(0);
    private final AtomicInteger predictionFailures = new AtomicInteger(0);
    private final AtomicInteger stakeRecommendations = new AtomicInteger(0);
    private final AtomicInteger placementAttempts = new AtomicInteger(0);
    private final AtomicInteger placements = new AtomicInteger(0);
    private final AtomicInteger refusals = new AtomicInteger(0);
    private final AtomicInteger settlements = new AtomicInteger(0);
    private final AtomicInteger duplicateSettlements = new AtomicInteger(0);

    public void recordPrediction(boolean wasRecommended) {
        predictions.incrementAndGet();
        if (wasRecommended) {
            recommended.incrementAndGet();
        } else {
            skipped.incrementAndGet();
        }
    }

    public void recordUnsupportedLeague() {
        unsupportedLeague.incrementAndGet();
    }

    public void recordPredictionFailure() {
        predictionFailures.incrementAndGet();
    }

    public void recordStakeRecommendation() {
        stakeRecommendations.incrementAndGet();
    }

    public void recordPlacementAttempt() {
        placementAttempts.incrementAndGet();
    }

    public void recordPlacement() {
        placements.incrementAndGet();
    }

    public void recordRefusal() {
        refusals.incrementAndGet();
    }

    public void recordSettlement() {
        settlements.incrementAndGet();
    }

    public void recordDuplicateSettlement() {
        duplicateSettlements.incrementAndGet();
    }

    public double refusalRate() {
        int attempts = placementAttempts.get();
        return attempts > 0 ? refusals.get() * 100.0 / attempts : 0.0;
    }

    public Map<String, Object> getMetrics() {
        int total = predictions.get();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("predictions", total);
        metrics.put("recommended", recommended.get());
        metrics.put("skipped", skipped.get());
        metrics.put("recommendRate", total > 0 ? recommended.get() * 100.0 / total : 0.0);
        metrics.put("unsupportedLeague", unsupportedLeague.get());
        metrics.put("predictionFailures", predictionFailures.get());
        metrics.put("stakeRecommendations", stakeRecommendations.get());
        metrics.put("placementAttempts", placementAttempts.get());
        metrics.put("placements", placements.get());
        metrics.put("refusals", refusals.get());
        metrics.put("refusalRate", refusalRate());
        metrics.put("settlements", settlements.get());
        metrics.put("duplicateSettlements", duplicateSettlements.get());
        return metrics;
    }

    @Scheduled(fixedRate = 60000) // Every minute
    public void logMetrics() {
        Map<String, Object> metrics = getMetrics();
        log.info("📊 Engine Metrics: {}", metrics);

        double refusalRate = (double) metrics.get("refusalRate");
        if (refusalRate > properties.getMetrics().getRefusalWarningRate()) {
            log.warn("⚠️ HIGH REFUSAL RATE: {}%", String.format("%.2f", refusalRate));
        }
    }
}
