package com.mouse.smartbet.adapter;

import com.mouse.smartbet.interfaces.FeatureAdapter;
import com.mouse.smartbet.model.FeatureOption;
import com.mouse.smartbet.model.MatchAttributes;
import com.mouse.smartbet.model.MatchInsights;
import com.mouse.smartbet.model.OddsTriple;
import com.mouse.smartbet.utils.OddsMath;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Serie A: mostly market-derived features computed from the 1X2 odds (12 features).
 */
@Component
public class SerieAFeatureAdapter implements FeatureAdapter {

    public static final String SCHEMA = "serie_a_v1";

    public static final FeatureOption GOALS_FOR_AWAY = FeatureOption.of("goals_for_away", 1.3);
    public static final FeatureOption RECENT_FORM_HOME = FeatureOption.of("recent_form_home", 1.5);
    public static final FeatureOption RECENT_FORM_AWAY = FeatureOption.of("recent_form_away", 1.2);

    static final double LOW_MARGIN = 0.03;
    static final double HIGH_MARGIN = 0.08;

    private static final List<FeatureOption> OPTIONS = List.of(GOALS_FOR_AWAY, RECENT_FORM_HOME, RECENT_FORM_AWAY);

    private static final List<String> FEATURES = List.of(
            "implied_prob_draw", "draw_away_ratio", "home_draw_ratio",
            "log_home_draw_odds", "log_draw_away_odds",
            "bookmaker_margin", "market_efficiency", "uncertainty_index",
            "draw_odds", "goals_for_away", "recent_form_home", "recent_form_away");

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
        double pHome = OddsMath.impliedProbability(odds.home());
        double pDraw = OddsMath.impliedProbability(odds.draw());
        double pAway = OddsMath.impliedProbability(odds.away());

        return new double[]{
                pDraw,
                pDraw / pAway,
                pHome / pDraw,
                Math.log(odds.home() / odds.draw()),
                Math.log(odds.draw() / odds.away()),
                OddsMath.bookmakerMargin(odds),
                OddsMath.marketEfficiency(odds),
                OddsMath.populationStdDev(pHome, pDraw, pAway),
                odds.draw(),
                match.value(GOALS_FOR_AWAY),
                match.value(RECENT_FORM_HOME),
                match.value(RECENT_FORM_AWAY)
        };
    }

    /**
     * Market reading of the 1X2 prices. The model has no win-rate inputs, so the team
     * signals keep their neutral defaults apart from recent form.
     */
    @Override
    public MatchInsights insights(MatchAttributes match) {
        OddsTriple odds = match.getOdds();
        double margin = OddsMath.bookmakerMargin(odds);

        MatchInsights.MatchInsightsBuilder insights = MatchInsights.builder()
                .homeForm(match.value(RECENT_FORM_HOME))
                .awayForm(match.value(RECENT_FORM_AWAY))
                .fact("market_efficiency", MatchInsights.percent(OddsMath.marketEfficiency(odds)))
                .fact("bookmaker_margin", MatchInsights.percent(margin))
                .fact("home_implied_prob", MatchInsights.percent(OddsMath.impliedProbability(odds.home())))
                .fact("draw_implied_prob", MatchInsights.percent(OddsMath.impliedProbability(odds.draw())))
                .fact("away_implied_prob", MatchInsights.percent(OddsMath.impliedProbability(odds.away())))
                .fact("most_likely_outcome", favourite(odds));

        if (margin < LOW_MARGIN) {
            insights.alert("Low margin market - good for value");
        } else if (margin > HIGH_MARGIN) {
            insights.alert("High margin market - bookmaker advantage");
        }
        return insights.build();
    }

    // shortest price; a home price must beat both others outright, away only the draw
    private static String favourite(OddsTriple odds) {
        if (odds.home() < Math.min(odds.draw(), odds.away())) {
            return "Home";
        }
        return odds.away() < odds.draw() ? "Away" : "Draw";
    }
}
