package com.mouse.smartbet;

import com.mouse.smartbet.entity.BankrollAccount;
import com.mouse.smartbet.entity.BetTransaction;
import com.mouse.smartbet.enums.BetStatus;
import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.enums.RiskProfile;
import com.mouse.smartbet.exception.AlreadySettledException;
import com.mouse.smartbet.exception.UnsupportedLeagueException;
import com.mouse.smartbet.model.BatchPredictionResult;
import com.mouse.smartbet.model.OpenAccountRequest;
import com.mouse.smartbet.model.PredictionRecord;
import com.mouse.smartbet.model.StakeRecommendation;
import com.mouse.smartbet.service.SmartBetEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Full flow against the in-memory H2 database and the bundled league catalog and models.
 */
@SpringBootTest
class SmartBetEngineIntegrationTest {

    @Autowired
    private SmartBetEngine engine;

    private BankrollAccount open(String initial) {
        return engine.openAccount(OpenAccountRequest.builder()
                .ownerId("owner-" + UUID.randomUUID())
                .initialBankroll(new BigDecimal(initial))
                .riskProfile(RiskProfile.BALANCED)
                .build());
    }

    private static Map<String, Object> match(String league, String home, String away,
                                             double homeOdds, double drawOdds, double awayOdds) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("league", league);
        raw.put("home_team", home);
        raw.put("away_team", away);
        raw.put("home_win_odds", homeOdds);
        raw.put("draw_odds", drawOdds);
        raw.put("away_win_odds", awayOdds);
        return raw;
    }

    @Test
    void predictRecommendPlaceAndSettle() {
        BankrollAccount account = open("1000");

        PredictionRecord prediction = engine.predict("Spain",
                match("Spain", "Real Madrid", "Sevilla", 1.85, 3.60, 4.20));

        assertThat(prediction.getLeagueKey()).isEqualTo("la_liga");
        assertThat(prediction.getProbabilities().sum()).isCloseTo(1.0, within(1e-9));
        assertThat(prediction.getConfidence()).isEqualTo(prediction.getProbabilities().max());
        assertThat(prediction.getExpectedValue())
                .isCloseTo(prediction.getConfidence() * prediction.getSelectedOdds() - 1, within(1e-12));
        assertThat(prediction.isRecommended())
                .isEqualTo(prediction.getConfidence() >= 0.60 && prediction.getSelectedOdds() >= 1.5);
        assertThat(prediction.getExplanation()).startsWith("The model predicts").endsWith(".");
        assertThat(prediction.getInsights()).containsKeys("home_win_rate", "home_recent_form", "expected_value");

        StakeRecommendation recommendation = engine.recommendStake(account.getId(), prediction);
        assertThat(recommendation.getMaxStakeAllowed()).isEqualByComparingTo("50.00");
        assertThat(recommendation.getRecommendedStake()).isLessThanOrEqualTo(recommendation.getMaxStakeAllowed());

        BetTransaction tx = engine.placeBet(account.getId(), Outcome.HOME, new BigDecimal("1.80"), new BigDecimal("10"));
        assertThat(tx.getStatus()).isEqualTo(BetStatus.PENDING);
        assertThat(engine.getAccount(account.getId()).getCurrentBankroll()).isEqualByComparingTo("990.00");
        assertThat(engine.pendingBets(account.getId())).hasSize(1);

        BetTransaction settled = engine.settleBet(tx.getId(), true, false);
        assertThat(settled.getProfitLoss()).isEqualByComparingTo("8.00");
        assertThat(settled.getActualReturn()).isEqualByComparingTo("18.00");

        assertThatThrownBy(() -> engine.settleBet(tx.getId(), false, false))
                .isInstanceOf(AlreadySettledException.class);

        BankrollAccount after = engine.getAccount(account.getId());
        assertThat(after.getCurrentBankroll()).isEqualByComparingTo("1008.00");
        assertThat(after.getTotalBetsPlaced()).isEqualTo(1);
        assertThat(after.getTotalBetsWon()).isEqualTo(1);
        assertThat(engine.pendingBets(account.getId())).isEmpty();
        assertThat(engine.history(account.getId())).hasSize(1);
    }

    @Test
    void lossAccumulatesInTheDailyWindow() {
        BankrollAccount account = open("200");

        BetTransaction tx = engine.placeBet(account.getId(), Outcome.DRAW, new BigDecimal("3.40"), new BigDecimal("10"));
        engine.settleBet(tx.getId(), false, false);

        BankrollAccount after = engine.getAccount(account.getId());
        assertThat(after.getCurrentBankroll()).isEqualByComparingTo("190.00");
        assertThat(after.getDailyLossAmount()).isEqualByComparingTo("10.00");
        assertThat(after.getWeeklyLossAmount()).isEqualByComparingTo("10.00");
        assertThat(after.getTotalProfitLoss()).isEqualByComparingTo("-10.00");
    }

    @Test
    void batchReportsUnsupportedLeaguesWithoutFailingTheRest() {
        BatchPredictionResult result = engine.predictBatch(List.of(
                match("Premier League", "Arsenal", "Chelsea", 2.10, 3.40, 3.50),
                match("Eredivisie", "Ajax", "PSV", 2.30, 3.50, 2.90),
                match("Bundesliga", "Bayern", "Dortmund", 1.60, 4.20, 5.00)));

        assertThat(result.getPredictions()).hasSize(2);
        assertThat(result.getUnsupportedCount()).isEqualTo(1);
        assertThat(result.getFailures().get(0).league()).isEqualTo("Eredivisie");

        assertThatThrownBy(() -> engine.predict("Eredivisie", match("Eredivisie", "Ajax", "PSV", 2.3, 3.5, 2.9)))
                .isInstanceOf(UnsupportedLeagueException.class);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void concurrentPlacementsKeepTheLedgerConsistent() throws Exception {
        BankrollAccount account = engine.openAccount(OpenAccountRequest.builder()
                .ownerId("owner-" + UUID.randomUUID())
                .initialBankroll(new BigDecimal("100"))
                .maxStakePercentage(25.0)
                .build());
        int threads = 10;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger placed = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            pool.submit(() -> {
                try {
                    start.await();
                    engine.placeBet(account.getId(), Outcome.HOME, new BigDecimal("2.00"), new BigDecimal("5"));
                    placed.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(20, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();

        BankrollAccount after = engine.getAccount(account.getId());
        assertThat(placed.get()).isEqualTo(threads);
        assertThat(after.getCurrentBankroll()).isEqualByComparingTo("50.00");
        assertThat(after.getTotalBetsPlaced()).isEqualTo(threads);
        assertThat(engine.history(account.getId())).hasSize(threads);
    }
}
