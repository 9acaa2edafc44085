package com.mouse.smartbet.enums;

public enum RecommendationReason {

    /** Confidence and odds both cleared the league thresholds */
    RECOMMENDED,

    /** Confidence cleared, selected odds below the league odds threshold */
    SKIP_LOW_ODDS,

    /** Odds cleared, confidence below the league confidence threshold */
    SKIP_LOW_CONFIDENCE,

    /** Both thresholds missed */
    SKIP_BOTH;

    public static RecommendationReason of(boolean meetsConfidence, boolean meetsOdds) {
        if (meetsConfidence && meetsOdds) return RECOMMENDED;
        if (meetsConfidence) return SKIP_LOW_ODDS;
        if (meetsOdds) return SKIP_LOW_CONFIDENCE;
        return SKIP_BOTH;
    }

    public boolean isRecommended() {
        return this == RECOMMENDED;
    }
}
