package com.mouse.smartbet.service;

import com.mouse.smartbet.model.MatchInsights;
import com.mouse.smartbet.model.PredictionRecord;
import com.mouse.smartbet.utils.OddsMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-language explanation of a gated prediction, written from the adapter's team signals,
 * plus the insight map shown next to it.
 */
@Component
public class PredictionExplainer {

    static final double STRONG_RECORD = 0.60;
    static final double WEAK_RECORD = 0.40;
    static final double GOOD_FORM = 1.6;
    static final double HIGH_CONFIDENCE = 0.75;
    static final double LOW_CONFIDENCE = 0.55;
    static final double VALUE_SIGNAL = 0.10;

    public String explain(PredictionRecord record, MatchInsights insights) {
        String home = record.getHomeTeam();
        String away = record.getAwayTeam();
        double hwr = insights.getHomeWinRate();
        double awr = insights.getAwayWinRate();
        double confidence = record.getConfidence();

        List<String> parts = new ArrayList<>();
        switch (record.getOutcome()) {
            case HOME -> {
                parts.add("The model predicts a " + home + " victory");
                if (hwr > STRONG_RECORD) {
                    parts.add("due to their strong home record (" + wholePct(hwr) + " win rate)");
                }
                if (insights.getHomeForm() > GOOD_FORM) {
                    parts.add("and excellent recent form");
                }
                if (awr < WEAK_RECORD) {
                    parts.add("against " + away + "'s poor away form (" + wholePct(awr) + " win rate)");
                }
            }
            case AWAY -> {
                parts.add("The model predicts an " + away + " victory");
                if (awr > STRONG_RECORD) {
                    parts.add("based on their strong away record (" + wholePct(awr) + " win rate)");
                }
                if (insights.getAwayForm() > GOOD_FORM) {
                    parts.add("and superior recent form");
                }
                if (hwr < WEAK_RECORD) {
                    parts.add("exploiting " + home + "'s weak home form (" + wholePct(hwr) + " win rate)");
                }
            }
            case DRAW -> {
                parts.add("The model predicts a draw");
                if (Math.abs(hwr - awr) < 0.10) {
                    parts.add("due to evenly matched teams (" + wholePct(hwr) + " vs " + wholePct(awr) + " win rates)");
                }
                if (Math.abs(insights.getHomeForm() - insights.getAwayForm()) < 0.3) {
                    parts.add("with similar recent form");
                }
            }
        }

        if (confidence > HIGH_CONFIDENCE) {
            parts.add("The model shows high confidence (" + MatchInsights.percent(confidence) + ")");
        } else if (confidence < LOW_CONFIDENCE) {
            parts.add("However, confidence is relatively low (" + MatchInsights.percent(confidence) + ")");
        }

        double implied = OddsMath.impliedProbability(record.getSelectedOdds());
        double valueSignal = confidence - implied;
        if (valueSignal > VALUE_SIGNAL) {
            parts.add("with excellent betting value (model sees " + MatchInsights.percent(confidence)
                    + " vs market's " + MatchInsights.percent(implied) + ")");
        } else if (valueSignal < -VALUE_SIGNAL) {
            parts.add("but the odds appear overpriced by the market");
        }

        String separator = parts.size() <= 2 ? ". " : ", ";
        return String.join(separator, parts) + ".";
    }

    /** Adapter facts followed by the expected value as a signed percentage. */
    public Map<String, String> insightMap(PredictionRecord record, MatchInsights insights) {
        Map<String, String> map = new LinkedHashMap<>(insights.getFacts());
        map.put("expected_value", String.format(Locale.ROOT, "%+.1f%%", record.getExpectedValue() * 100.0));
        return map;
    }

    private static String wholePct(double fraction) {
        return String.format(Locale.ROOT, "%.0f%%", fraction * 100.0);
    }
}
