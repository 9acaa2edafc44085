package com.mouse.smartbet.service;

import com.mouse.smartbet.entity.BankrollAccount;
import com.mouse.smartbet.enums.RiskProfile;
import com.mouse.smartbet.exception.InvalidInputException;
import com.mouse.smartbet.finance.BankrollLedger;
import com.mouse.smartbet.logservice.BetFlowLogger;
import com.mouse.smartbet.model.PlacementCheck;
import com.mouse.smartbet.model.StakeParams;
import com.mouse.smartbet.model.StakeRecommendation;
import com.mouse.smartbet.model.StakeRequest;
import com.mouse.smartbet.model.StakeSizing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Advisory staking. Reads the account, never writes it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StakeRecommendationService {

    private final BankrollLedger ledger;
    private final StakeSizer stakeSizer;
    private final BetFlowLogger flowLogger;
    private final EngineMetricsService metricsService;

    public StakeRecommendation recommend(Long accountId, StakeRequest request) {
        if (request == null || request.getOutcome() == null) {
            throw new InvalidInputException("Stake request must name an outcome");
        }
        BankrollAccount account = ledger.getAccount(accountId);
        Instant now = ledger.now();

        StakeSizing sizing = stakeSizer.size(
                account.getCurrentBankroll(),
                account.getStrategy().getCode(),
                request.getWinProbability(),
                request.getOdds(),
                request.getConfidencePct(),
                paramsOf(account),
                account.getMaxStakePercentage());

        List<String> warnings = new ArrayList<>(sizing.getWarnings());
        if (Boolean.FALSE.equals(request.getRecommendedByGate())) {
            warnings.add("Prediction did not pass the league gate - betting is not recommended");
        }
        RiskProfile profile = account.getRiskProfile();
        if (request.getConfidencePct() < profile.getMinConfidencePct()) {
            warnings.add(String.format("Confidence %.1f%% is below the %s minimum of %.0f%%",
                    request.getConfidencePct(), profile, profile.getMinConfidencePct()));
        }
        if (request.getExpectedValue() < profile.getMinExpectedValue()) {
            warnings.add(String.format("Expected value %.2f%% is below the %s minimum of %.0f%%",
                    request.getExpectedValue() * 100, profile, profile.getMinExpectedValue() * 100));
        }

        PlacementCheck check = null;
        if (sizing.hasStake()) {
            check = ledger.canPlace(account, sizing.getStakeAmount(), now);
            if (check.isAllowed()) {
                warnings.addAll(check.getWarnings());
            } else {
                warnings.add("Ledger would refuse this stake: " + check.getReason());
            }
        }

        StakeRecommendation recommendation = StakeRecommendation.builder()
                .accountId(account.getId())
                .predictionId(request.getPredictionId())
                .outcome(request.getOutcome())
                .odds(request.getOdds())
                .winProbability(request.getWinProbability())
                .recommendedStake(sizing.getStakeAmount())
                .stakePercentage(sizing.getStakePercentage())
                .maxStakeAllowed(sizing.getMaxStakeAllowed())
                .strategy(sizing.getStrategyCode())
                .kelly(sizing.getKelly())
                .riskLevel(sizing.getRisk().getLevel())
                .riskFactors(sizing.getRisk().getFactors())
                .riskExplanation(sizing.getRisk().getExplanation())
                .placementVerdict(check != null ? check.getVerdict() : null)
                .warnings(warnings)
                .createdAt(now)
                .build();

        metricsService.recordStakeRecommendation();
        flowLogger.logStakeRecommendation(account.getId(), recommendation);
        return recommendation;
    }

    private static StakeParams paramsOf(BankrollAccount account) {
        return StakeParams.builder()
                .kellyFraction(account.getKellyFraction())
                .fixedAmount(account.getFixedStakeAmount())
                .fixedPercentage(account.getFixedStakePercentage())
                .build();
    }
}
