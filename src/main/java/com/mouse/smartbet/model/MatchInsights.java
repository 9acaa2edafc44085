package com.mouse.smartbet.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * What a league adapter reads out of a fixture for display: formatted facts, league alerts,
 * and the team signals the prediction explanation is written from.
 *
 * Win rates are fractions in [0, 1]; form is average points per game over recent matches.
 */
@Value
@Builder
public class MatchInsights {

    public static final double DEFAULT_WIN_RATE = 0.5;
    public static final double DEFAULT_HOME_FORM = 1.5;
    public static final double DEFAULT_AWAY_FORM = 1.2;

    @Singular
    Map<String, String> facts;

    @Singular
    List<String> alerts;

    @Builder.Default
    double homeWinRate = DEFAULT_WIN_RATE;
    @Builder.Default
    double awayWinRate = DEFAULT_WIN_RATE;
    @Builder.Default
    double homeForm = DEFAULT_HOME_FORM;
    @Builder.Default
    double awayForm = DEFAULT_AWAY_FORM;

    public static MatchInsights empty() {
        return MatchInsights.builder().build();
    }

    /** 0.523 -> "52.3%" */
    public static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0);
    }

    /** 1.45 -> "1.5 goals/game" */
    public static String perGame(double value, String unit) {
        return String.format(Locale.ROOT, "%.1f %s/game", value, unit);
    }

    /**
     * Points-per-game form as a label with a typical last-three sequence.
     */
    public static String formDisplay(double form) {
        if (form >= 2.0) {
            return "Excellent (W-W-W)";
        } else if (form >= 1.7) {
            return "Good (W-W-D)";
        } else if (form >= 1.4) {
            return "Average (W-D-L)";
        } else if (form >= 1.1) {
            return "Poor (D-L-L)";
        }
        return "Very Poor (L-L-L)";
    }
}
