package com.mouse.smartbet.adapter;

import com.mouse.smartbet.interfaces.FeatureAdapter;
import com.mouse.smartbet.model.FeatureOption;
import com.mouse.smartbet.model.MatchAttributes;
import com.mouse.smartbet.model.MatchInsights;
import com.mouse.smartbet.model.OddsTriple;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * La Liga: recent form, raw 1X2 odds, goal averages and win rates (12 features).
 */
@Component
public class LaLigaFeatureAdapter implements FeatureAdapter {

    public static final String SCHEMA = "la_liga_v1";

    public static final FeatureOption HOME_RECENT_FORM = FeatureOption.of("home_recent_form", 1.5);
    public static final FeatureOption AWAY_RECENT_FORM = FeatureOption.of("away_recent_form", 1.2);
    public static final FeatureOption HOME_GOALS_FOR = FeatureOption.of("home_goals_for", 1.5);
    public static final FeatureOption HOME_GOALS_AGAINST = FeatureOption.of("home_goals_against", 1.2);
    public static final FeatureOption AWAY_GOALS_FOR = FeatureOption.of("away_goals_for", 1.3);
    public static final FeatureOption AWAY_GOALS_AGAINST = FeatureOption.of("away_goals_against", 1.4);
    public static final FeatureOption HOME_WIN_RATE = FeatureOption.of("home_win_rate", 0.5);
    public static final FeatureOption AWAY_WIN_RATE = FeatureOption.of("away_win_rate", 0.5);
    public static final FeatureOption RECENT_FORM_DIFF = FeatureOption.of("recent_form_diff", 0.3);

    private static final List<FeatureOption> OPTIONS = List.of(
            HOME_RECENT_FORM, AWAY_RECENT_FORM, HOME_GOALS_FOR, HOME_GOALS_AGAINST,
            AWAY_GOALS_FOR, AWAY_GOALS_AGAINST, HOME_WIN_RATE, AWAY_WIN_RATE, RECENT_FORM_DIFF);

    private static final List<String> FEATURES = List.of(
            "home_recent_form", "away_recent_form",
            "home_win_odds", "away_win_odds", "draw_odds",
            "home_goals_for", "home_goals_against", "away_goals_for", "away_goals_against",
            "home_win_rate", "away_win_rate", "recent_form_diff");

    @Override
    public String schemaId() {
        return SCHEMA;
    }

    @Override
    public List<String> featureNames() {
        return FEATURES;
    }

    @Override
    public List<FeatureOption> options() {
        return OPTIONS;
    }

    @Override
    public double[] toFeatureVector(MatchAttributes match) {
        OddsTriple odds = match.getOdds();
        return new double[]{
                match.value(HOME_RECENT_FORM),
                match.value(AWAY_RECENT_FORM),
                odds.home(),
                odds.away(),
                odds.draw(),
                match.value(HOME_GOALS_FOR),
                match.value(HOME_GOALS_AGAINST),
                match.value(AWAY_GOALS_FOR),
                match.value(AWAY_GOALS_AGAINST),
                match.value(HOME_WIN_RATE),
                match.value(AWAY_WIN_RATE),
                match.value(RECENT_FORM_DIFF)
        };
    }

    @Override
    public MatchInsights insights(MatchAttributes match) {
        double homeWinRate = match.value(HOME_WIN_RATE);
        double awayWinRate = match.value(AWAY_WIN_RATE);
        double homeForm = match.value(HOME_RECENT_FORM);
        double awayForm = match.value(AWAY_RECENT_FORM);

        MatchInsights.MatchInsightsBuilder insights = MatchInsights.builder()
                .homeWinRate(homeWinRate)
                .awayWinRate(awayWinRate)
                .homeForm(homeForm)
                .awayForm(awayForm)
                .fact("home_win_rate", MatchInsights.percent(homeWinRate))
                .fact("away_win_rate", MatchInsights.percent(awayWinRate))
                .fact("home_recent_form", MatchInsights.formDisplay(homeForm))
                .fact("away_recent_form", MatchInsights.formDisplay(awayForm))
                .fact("home_attack", MatchInsights.perGame(match.value(HOME_GOALS_FOR), "goals"))
                .fact("home_defense", MatchInsights.perGame(match.value(HOME_GOALS_AGAINST), "conceded"))
                .fact("away_attack", MatchInsights.perGame(match.value(AWAY_GOALS_FOR), "goals"))
                .fact("away_defense", MatchInsights.perGame(match.value(AWAY_GOALS_AGAINST), "conceded"))
                .fact("recent_form_diff", String.format(Locale.ROOT, "%+.1f", match.value(RECENT_FORM_DIFF)));
        TeamRecordAlerts.apply(insights, homeWinRate, awayWinRate);
        return insights.build();
    }
}
