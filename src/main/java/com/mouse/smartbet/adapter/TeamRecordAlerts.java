package com.mouse.smartbet.adapter;

import com.mouse.smartbet.model.MatchInsights;

/**
 * Home/away record alerts for the leagues whose models are fed team win rates.
 */
final class TeamRecordAlerts {

    static final double STRONG_HOME_WIN_RATE = 0.70;
    static final double STRONG_AWAY_WIN_RATE = 0.65;
    static final double WEAK_AWAY_WIN_RATE = 0.30;

    private TeamRecordAlerts() {
    }

    static void apply(MatchInsights.MatchInsightsBuilder insights, double homeWinRate, double awayWinRate) {
        if (homeWinRate > STRONG_HOME_WIN_RATE) {
            insights.alert("Strong home team advantage");
        }
        if (awayWinRate > STRONG_AWAY_WIN_RATE) {
            insights.alert("Excellent away team record");
        }
        if (awayWinRate < WEAK_AWAY_WIN_RATE) {
            insights.alert("Away team struggles on the road");
        }
    }
}
