package com.mouse.smartbet.adapter;

import com.mouse.smartbet.interfaces.FeatureAdapter;
import com.mouse.smartbet.model.FeatureOption;
import com.mouse.smartbet.model.MatchAttributes;
import com.mouse.smartbet.model.MatchInsights;
import com.mouse.smartbet.model.OddsTriple;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class PremierLeagueFeatureAdapter implements FeatureAdapter {

    public static final String SCHEMA = "premier_league_v1";

    public static final FeatureOption HOME_AVG_GOALS_FOR = FeatureOption.of("home_avg_goals_for", 1.5);
    public static final FeatureOption AWAY_AVG_GOALS_FOR = FeatureOption.of("away_avg_goals_for", 1.3);
    public static final FeatureOption HOME_WIN_RATE = FeatureOption.of("home_win_rate", 0.5);
    public static final FeatureOption AWAY_WIN_RATE = FeatureOption.of("away_win_rate", 0.5);

    private static final List<FeatureOption> OPTIONS = List.of(
            HOME_AVG_GOALS_FOR, AWAY_AVG_GOALS_FOR, HOME_WIN_RATE, AWAY_WIN_RATE);

    private static final List<String> FEATURES = List.of(
            "home_avg_goals_for", "away_avg_goals_for",
            "home_win_odds", "away_win_odds", "draw_odds",
            "home_win_rate", "away_win_rate");

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
                match.value(HOME_AVG_GOALS_FOR),
                match.value(AWAY_AVG_GOALS_FOR),
                odds.home(),
                odds.away(),
                odds.draw(),
                match.value(HOME_WIN_RATE),
                match.value(AWAY_WIN_RATE)
        };
    }

    // experimental model: facts only, no league alerts
    @Override
    public MatchInsights insights(MatchAttributes match) {
        double hwr = match.value(HOME_WIN_RATE);
        double awr = match.value(AWAY_WIN_RATE);
        return MatchInsights.builder()
                .homeWinRate(hwr)
                .awayWinRate(awr)
                .fact("home_win_rate", MatchInsights.percent(hwr))
                .fact("away_win_rate", MatchInsights.percent(awr))
                .fact("home_attack", MatchInsights.perGame(match.value(HOME_AVG_GOALS_FOR), "goals"))
                .fact("away_attack", MatchInsights.perGame(match.value(AWAY_AVG_GOALS_FOR), "goals"))
                .fact("win_rate_diff", String.format(Locale.ROOT, "%+.1f%%", (hwr - awr) * 100.0))
                .build();
    }
}
