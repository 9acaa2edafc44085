package com.mouse.smartbet.adapter;

import com.mouse.smartbet.interfaces.FeatureAdapter;
import com.mouse.smartbet.model.FeatureOption;
import com.mouse.smartbet.model.MatchAttributes;
import com.mouse.smartbet.model.MatchInsights;

import java.util.List;
import java.util.Locale;

/**
 * Shared layout of the jointly trained Bundesliga / Ligue 1 models: per-side goal averages,
 * win and draw rates, a one-hot league flag pair and two difference features (12 features).
 * Subclasses only supply their league's defaults and flag.
 */
public abstract class GoalRateFeatureAdapter implements FeatureAdapter {

    private static final List<String> FEATURES = List.of(
            "home_avg_goals_for", "home_avg_goals_against", "home_win_rate", "home_draw_rate",
            "away_avg_goals_for", "away_avg_goals_against", "away_win_rate", "away_draw_rate",
            "is_bundesliga", "is_ligue1",
            "goal_difference_tendency", "win_rate_difference");

    private final String schemaId;
    private final FeatureOption homeGoalsFor;
    private final FeatureOption homeGoalsAgainst;
    private final FeatureOption homeWinRate;
    private final FeatureOption homeDrawRate;
    private final FeatureOption awayGoalsFor;
    private final FeatureOption awayGoalsAgainst;
    private final FeatureOption awayWinRate;
    private final FeatureOption awayDrawRate;
    private final double bundesligaFlag;
    private final double ligue1Flag;

    protected GoalRateFeatureAdapter(String schemaId, double[] defaults, boolean bundesliga) {
        if (defaults.length != 8) {
            throw new IllegalArgumentException("Expected 8 defaults, got " + defaults.length);
        }
        this.schemaId = schemaId;
        this.homeGoalsFor = FeatureOption.of("home_avg_goals_for", defaults[0]);
        this.homeGoalsAgainst = FeatureOption.of("home_avg_goals_against", defaults[1]);
        this.awayGoalsFor = FeatureOption.of("away_avg_goals_for", defaults[2]);
        this.awayGoalsAgainst = FeatureOption.of("away_avg_goals_against", defaults[3]);
        this.homeWinRate = FeatureOption.of("home_win_rate", defaults[4]);
        this.awayWinRate = FeatureOption.of("away_win_rate", defaults[5]);
        this.homeDrawRate = FeatureOption.of("home_draw_rate", defaults[6]);
        this.awayDrawRate = FeatureOption.of("away_draw_rate", defaults[7]);
        this.bundesligaFlag = bundesliga ? 1.0 : 0.0;
        this.ligue1Flag = bundesliga ? 0.0 : 1.0;
    }

    @Override
    public String schemaId() {
        return schemaId;
    }

    @Override
    public List<String> featureNames() {
        return FEATURES;
    }

    @Override
    public List<FeatureOption> options() {
        return List.of(homeGoalsFor, homeGoalsAgainst, awayGoalsFor, awayGoalsAgainst,
                homeWinRate, awayWinRate, homeDrawRate, awayDrawRate);
    }

    @Override
    public double[] toFeatureVector(MatchAttributes match) {
        double hgf = match.value(homeGoalsFor);
        double hga = match.value(homeGoalsAgainst);
        double agf = match.value(awayGoalsFor);
        double aga = match.value(awayGoalsAgainst);
        double hwr = match.value(homeWinRate);
        double awr = match.value(awayWinRate);

        return new double[]{
                hgf,
                hga,
                hwr,
                match.value(homeDrawRate),
                agf,
                aga,
                awr,
                match.value(awayDrawRate),
                bundesligaFlag,
                ligue1Flag,
                (hgf - hga) - (agf - aga),
                hwr - awr
        };
    }

    /** No form inputs here, so form stays at the neutral defaults. */
    @Override
    public MatchInsights insights(MatchAttributes match) {
        double hwr = match.value(homeWinRate);
        double awr = match.value(awayWinRate);

        MatchInsights.MatchInsightsBuilder insights = MatchInsights.builder()
                .homeWinRate(hwr)
                .awayWinRate(awr)
                .fact("home_win_rate", MatchInsights.percent(hwr))
                .fact("away_win_rate", MatchInsights.percent(awr))
                .fact("home_attack", MatchInsights.perGame(match.value(homeGoalsFor), "goals"))
                .fact("away_attack", MatchInsights.perGame(match.value(awayGoalsFor), "goals"))
                .fact("win_rate_diff", String.format(Locale.ROOT, "%+.1f%%", (hwr - awr) * 100.0));
        TeamRecordAlerts.apply(insights, hwr, awr);
        return insights.build();
    }
}
