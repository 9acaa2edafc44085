package com.mouse.smartbet.service;

import com.mouse.smartbet.enums.RiskLevel;
import com.mouse.smartbet.model.RiskAssessment;
import com.mouse.smartbet.utils.OddsMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Additive rule table. Score 0 is LOW, 1-2 MEDIUM, 3 and above HIGH.
 *
 * <pre>
 *   stake      > 5%  +2 | > 3%  +1
 *   confidence < 60% +2 | < 70% +1
 *   odds       > 3.0 +2 | > 2.0 +1
 *   edge       < 5%  +1   (probability - 1/odds)
 * </pre>
 */
@Component
public class RiskClassifier {

    public RiskAssessment classify(double stakePercentage, double confidencePct, double odds, double edge) {
        List<String> factors = new ArrayList<>();
        int score = 0;

        if (stakePercentage > 5.0) {
            score += 2;
            factors.add(String.format("Large stake (%.1f%% of bankroll)", stakePercentage));
        } else if (stakePercentage > 3.0) {
            score += 1;
            factors.add(String.format("Moderate stake (%.1f%% of bankroll)", stakePercentage));
        }

        if (confidencePct < 60.0) {
            score += 2;
            factors.add(String.format("Lower confidence (%.1f%%)", confidencePct));
        } else if (confidencePct < 70.0) {
            score += 1;
            factors.add(String.format("Moderate confidence (%.1f%%)", confidencePct));
        }

        if (odds > 3.0) {
            score += 2;
            factors.add(String.format("High odds (%.2f) = higher variance", odds));
        } else if (odds > 2.0) {
            score += 1;
            factors.add(String.format("Moderate odds (%.2f)", odds));
        }

        if (edge < 0.05) {
            score += 1;
            factors.add("Small edge vs market");
        }

        RiskLevel level = RiskLevel.fromScore(score);
        String explanation = switch (level) {
            case LOW -> "Low risk bet: Conservative stake, high confidence, good odds";
            case MEDIUM -> "Medium risk bet: " + String.join(", ", factors);
            default -> "High risk bet: " + String.join(", ", factors);
        };

        return RiskAssessment.builder()
                .level(level)
                .score(score)
                .factors(factors)
                .explanation(explanation)
                .build();
    }

    public RiskAssessment classifyProbability(double stakePercentage, double winProbability, double odds) {
        return classify(stakePercentage, winProbability * 100.0, odds, OddsMath.edge(winProbability, odds));
    }
}
