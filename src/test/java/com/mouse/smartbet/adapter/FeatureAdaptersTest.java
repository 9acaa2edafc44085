package com.mouse.smartbet.adapter;

import com.mouse.smartbet.interfaces.FeatureAdapter;
import com.mouse.smartbet.model.MatchAttributes;
import com.mouse.smartbet.model.MatchInsights;
import com.mouse.smartbet.model.OddsTriple;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class FeatureAdaptersTest {

    static Stream<Arguments> adapters() {
        return Stream.of(
                Arguments.of(new LaLigaFeatureAdapter(), 12),
                Arguments.of(new SerieAFeatureAdapter(), 12),
                Arguments.of(new BundesligaFeatureAdapter(), 12),
                Arguments.of(new Ligue1FeatureAdapter(), 12),
                Arguments.of(new PremierLeagueFeatureAdapter(), 7));
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void toFeatureVector_lengthMatchesDeclaredSchema(FeatureAdapter adapter, int expected) {
        double[] v = adapter.toFeatureVector(match().build());

        assertThat(adapter.featureCount()).isEqualTo(expected);
        assertThat(v).hasSize(expected);
        assertThat(adapter.featureNames()).doesNotHaveDuplicates();
        for (double x : v) {
            assertThat(Double.isFinite(x)).isTrue();
        }
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void toFeatureVector_isPure(FeatureAdapter adapter, int ignored) {
        MatchAttributes m = match().stat("home_win_rate", 0.7).build();
        assertThat(adapter.toFeatureVector(m)).containsExactly(adapter.toFeatureVector(m));
    }

    @Test
    void laLiga_missingOptionals_useDocumentedDefaults() {
        double[] v = new LaLigaFeatureAdapter().toFeatureVector(match().build());

        assertThat(v).containsExactly(1.5, 1.2, 2.10, 3.60, 3.40, 1.5, 1.2, 1.3, 1.4, 0.5, 0.5, 0.3);
    }

    @Test
    void laLiga_suppliedStatsOverrideDefaults() {
        double[] v = new LaLigaFeatureAdapter().toFeatureVector(match()
                .stat("home_recent_form", 2.4)
                .stat("away_goals_against", 0.9)
                .build());

        assertThat(v[0]).isEqualTo(2.4);
        assertThat(v[8]).isEqualTo(0.9);
    }

    @Test
    void serieA_derivesMarketFeaturesFromOdds() {
        OddsTriple odds = OddsTriple.of(2.0, 4.0, 4.0);
        double[] v = new SerieAFeatureAdapter().toFeatureVector(match().odds(odds).build());

        assertThat(v[0]).isCloseTo(0.25, within(1e-12));               // implied draw
        assertThat(v[1]).isCloseTo(1.0, within(1e-12));                // draw / away
        assertThat(v[2]).isCloseTo(2.0, within(1e-12));                // home / draw
        assertThat(v[3]).isCloseTo(Math.log(0.5), within(1e-12));
        assertThat(v[4]).isCloseTo(0.0, within(1e-12));
        assertThat(v[5]).isCloseTo(0.0, within(1e-12));                // fair book, no margin
        assertThat(v[6]).isCloseTo(1.0, within(1e-12));
        assertThat(v[8]).isEqualTo(4.0);
        assertThat(v[9]).isEqualTo(1.3);
    }

    @Test
    void bundesligaAndLigue1_differOnlyInDefaultsAndLeagueFlag() {
        double[] bl = new BundesligaFeatureAdapter().toFeatureVector(match().build());
        double[] l1 = new Ligue1FeatureAdapter().toFeatureVector(match().build());

        assertThat(bl[8]).isEqualTo(1.0);
        assertThat(bl[9]).isEqualTo(0.0);
        assertThat(l1[8]).isEqualTo(0.0);
        assertThat(l1[9]).isEqualTo(1.0);

        // (1.8 - 1.3) - (1.5 - 1.4) and 0.5 - 0.4
        assertThat(bl[10]).isCloseTo(0.4, within(1e-9));
        assertThat(bl[11]).isCloseTo(0.1, within(1e-9));
        assertThat(l1[0]).isEqualTo(1.6);
    }

    @Test
    void premierLeague_ordersOddsHomeAwayDraw() {
        double[] v = new PremierLeagueFeatureAdapter().toFeatureVector(match().build());

        assertThat(v).containsExactly(1.5, 1.3, 2.10, 3.60, 3.40, 0.5, 0.5);
    }

    // --------------- insights ----------------

    @Test
    void laLiga_insights_formatRatesFormAndGoals() {
        MatchInsights insights = new LaLigaFeatureAdapter().insights(match().build());

        assertThat(insights.getFacts()).containsExactly(
                entry("home_win_rate", "50.0%"),
                entry("away_win_rate", "50.0%"),
                entry("home_recent_form", "Average (W-D-L)"),
                entry("away_recent_form", "Poor (D-L-L)"),
                entry("home_attack", "1.5 goals/game"),
                entry("home_defense", "1.2 conceded/game"),
                entry("away_attack", "1.3 goals/game"),
                entry("away_defense", "1.4 conceded/game"),
                entry("recent_form_diff", "+0.3"));
        assertThat(insights.getAlerts()).isEmpty();
        assertThat(insights.getHomeForm()).isEqualTo(1.5);
        assertThat(insights.getAwayForm()).isEqualTo(1.2);
    }

    @Test
    void bundesliga_insights_flagStrongRecords() {
        MatchInsights insights = new BundesligaFeatureAdapter().insights(match()
                .stat("home_win_rate", 0.72)
                .stat("away_win_rate", 0.68)
                .build());

        assertThat(insights.getAlerts()).containsExactly("Strong home team advantage", "Excellent away team record");
        assertThat(insights.getFacts()).containsEntry("win_rate_diff", "+4.0%");
        assertThat(insights.getHomeWinRate()).isEqualTo(0.72);
    }

    @Test
    void ligue1_insights_flagWeakAwaySide() {
        MatchInsights insights = new Ligue1FeatureAdapter().insights(match().stat("away_win_rate", 0.2).build());

        assertThat(insights.getAlerts()).containsExactly("Away team struggles on the road");
        assertThat(insights.getFacts()).containsEntry("home_win_rate", "45.0%");
    }

    @Test
    void premierLeague_insights_haveFactsButNoLeagueAlerts() {
        MatchInsights insights = new PremierLeagueFeatureAdapter().insights(match()
                .stat("home_win_rate", 0.9)
                .stat("away_win_rate", 0.1)
                .build());

        assertThat(insights.getAlerts()).isEmpty();
        assertThat(insights.getFacts()).containsEntry("win_rate_diff", "+80.0%");
    }

    @Test
    void serieA_insights_readTheMarketMargin() {
        SerieAFeatureAdapter adapter = new SerieAFeatureAdapter();

        MatchInsights fair = adapter.insights(match().odds(OddsTriple.of(2.0, 4.0, 4.0)).build());
        assertThat(fair.getAlerts()).containsExactly("Low margin market - good for value");
        assertThat(fair.getFacts())
                .containsEntry("bookmaker_margin", "0.0%")
                .containsEntry("market_efficiency", "100.0%")
                .containsEntry("home_implied_prob", "50.0%")
                .containsEntry("most_likely_outcome", "Home");

        // 1/1.8 + 1/3.2 + 1/4.0 = 1.118
        MatchInsights greedy = adapter.insights(match().odds(OddsTriple.of(1.80, 3.20, 4.00)).build());
        assertThat(greedy.getAlerts()).containsExactly("High margin market - bookmaker advantage");

        MatchInsights normal = adapter.insights(match().build());
        assertThat(normal.getAlerts()).isEmpty();
        assertThat(normal.getHomeWinRate()).isEqualTo(MatchInsights.DEFAULT_WIN_RATE);
    }

    @Test
    void serieA_insights_favouriteIsTheShortestPrice() {
        SerieAFeatureAdapter adapter = new SerieAFeatureAdapter();

        assertThat(adapter.insights(match().odds(OddsTriple.of(3.5, 2.9, 3.0)).build()).getFacts())
                .containsEntry("most_likely_outcome", "Draw");
        assertThat(adapter.insights(match().odds(OddsTriple.of(3.5, 3.4, 2.2)).build()).getFacts())
                .containsEntry("most_likely_outcome", "Away");
    }

    private static MatchAttributes.MatchAttributesBuilder match() {
        return MatchAttributes.builder()
                .homeTeam("Home FC")
                .awayTeam("Away FC")
                .odds(OddsTriple.of(2.10, 3.40, 3.60));
    }
}
