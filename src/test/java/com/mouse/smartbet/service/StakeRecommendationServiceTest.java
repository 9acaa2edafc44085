package com.mouse.smartbet.service;

import com.mouse.smartbet.config.SmartBetProperties;
import com.mouse.smartbet.entity.BankrollAccount;
import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.enums.PlacementVerdict;
import com.mouse.smartbet.enums.RecommendationReason;
import com.mouse.smartbet.enums.RiskLevel;
import com.mouse.smartbet.enums.RiskProfile;
import com.mouse.smartbet.enums.StakingStrategy;
import com.mouse.smartbet.exception.InvalidInputException;
import com.mouse.smartbet.finance.BankrollLedger;
import com.mouse.smartbet.logservice.BetFlowLogger;
import com.mouse.smartbet.model.PlacementCheck;
import com.mouse.smartbet.model.PredictionRecord;
import com.mouse.smartbet.model.StakeRecommendation;
import com.mouse.smartbet.model.StakeRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StakeRecommendationServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-26T12:00:00Z");

    @Mock
    private BankrollLedger ledger;

    @Mock
    private BetFlowLogger flowLogger;

    @Mock
    private EngineMetricsService metricsService;

    private StakeRecommendationService service;
    private BankrollAccount account;

    @BeforeEach
    void setUp() {
        StakeSizer sizer = new StakeSizer(new SmartBetProperties(), new RiskClassifier());
        service = new StakeRecommendationService(ledger, sizer, flowLogger, metricsService);

        account = BankrollAccount.builder()
                .id(7L)
                .ownerId("alice")
                .initialBankroll(new BigDecimal("1000.00"))
                .currentBankroll(new BigDecimal("1000.00"))
                .strategy(StakingStrategy.KELLY_FRACTIONAL)
                .riskProfile(RiskProfile.BALANCED)
                .maxStakePercentage(5.0)
                .kellyFraction(0.5)
                .dailyWindowStart(NOW)
                .weeklyWindowStart(NOW)
                .createdAt(NOW)
                .lastUpdated(NOW)
                .build();

        lenient().when(ledger.getAccount(7L)).thenReturn(account);
        lenient().when(ledger.now()).thenReturn(NOW);
    }

    @Test
    void recommend_clampsStakeAndCollectsAllWarnings() {
        when(ledger.canPlace(eq(account), any(BigDecimal.class), eq(NOW)))
                .thenReturn(PlacementCheck.allowed(List.of("Bet uses >50% of remaining daily loss limit ($100.00 left)")));

        StakeRecommendation r = service.recommend(7L, StakeRequest.raw(Outcome.HOME, 0.58, 2.0));

        assertThat(r.getRecommendedStake()).isEqualByComparingTo("50.00");
        assertThat(r.getMaxStakeAllowed()).isEqualByComparingTo("50.00");
        assertThat(r.getStrategy()).isEqualTo("kelly_fractional");
        assertThat(r.getKelly().fractionUsed()).isEqualTo(0.5);
        assertThat(r.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(r.getPlacementVerdict()).isEqualTo(PlacementVerdict.ALLOWED);
        assertThat(r.isPlaceable()).isTrue();
        assertThat(r.getWarnings()).containsExactly(
                "Stake reduced from $80.00 to $50.00 (max 5.0% limit)",
                "Confidence 58.0% is below the BALANCED minimum of 60%",
                "Bet uses >50% of remaining daily loss limit ($100.00 left)");
        assertThat(r.getCreatedAt()).isEqualTo(NOW);
        verify(metricsService).recordStakeRecommendation();
        verify(flowLogger).logStakeRecommendation(7L, r);
    }

    @Test
    void recommend_ledgerRefusal_isReportedNotThrown() {
        when(ledger.canPlace(eq(account), any(BigDecimal.class), eq(NOW)))
                .thenReturn(PlacementCheck.refused(PlacementVerdict.DAILY_LOSS_LIMIT,
                        "Daily loss limit reached: stake 50.00 exceeds remaining 0.00"));

        StakeRecommendation r = service.recommend(7L, StakeRequest.raw(Outcome.HOME, 0.70, 2.0));

        assertThat(r.getPlacementVerdict()).isEqualTo(PlacementVerdict.DAILY_LOSS_LIMIT);
        assertThat(r.isPlaceable()).isFalse();
        assertThat(r.getWarnings())
                .contains("Ledger would refuse this stake: Daily loss limit reached: stake 50.00 exceeds remaining 0.00");
    }

    @Test
    void recommend_noEdge_skipsLedgerCheck() {
        StakeRecommendation r = service.recommend(7L, StakeRequest.raw(Outcome.AWAY, 0.40, 2.0));

        assertThat(r.getRecommendedStake()).isEqualByComparingTo("0");
        assertThat(r.getRiskLevel()).isEqualTo(RiskLevel.NONE);
        assertThat(r.getPlacementVerdict()).isNull();
        assertThat(r.getWarnings()).contains("non-positive edge");
        verify(ledger, never()).canPlace(any(), any(), any());
    }

    @Test
    void recommend_gateRejectedPrediction_addsWarning() {
        when(ledger.canPlace(eq(account), any(BigDecimal.class), eq(NOW))).thenReturn(PlacementCheck.allowed(List.of()));
        PredictionRecord prediction = PredictionRecord.builder()
                .predictionId("p-1")
                .leagueKey("la_liga")
                .homeTeam("Girona")
                .awayTeam("Getafe")
                .outcome(Outcome.HOME)
                .confidence(0.58)
                .selectedOdds(1.80)
                .expectedValue(0.58 * 1.80 - 1)
                .recommended(false)
                .reason(RecommendationReason.SKIP_LOW_CONFIDENCE)
                .build();

        StakeRecommendation r = service.recommend(7L, StakeRequest.fromPrediction(prediction));

        assertThat(r.getPredictionId()).isEqualTo("p-1");
        assertThat(r.getWarnings()).contains("Prediction did not pass the league gate - betting is not recommended");
        assertThat(r.getWarnings()).contains("Confidence 58.0% is below the BALANCED minimum of 60%");
        // half Kelly of (0.8 * 0.58 - 0.42) / 0.8 = 0.055
        assertThat(r.getRecommendedStake()).isEqualByComparingTo("27.50");
    }

    @Test
    void recommend_missingOutcome_throwsInvalidInput() {
        assertThatThrownBy(() -> service.recommend(7L, StakeRequest.builder().winProbability(0.6).odds(2.0).build()))
                .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(ledger);
    }
}
