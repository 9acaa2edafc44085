package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.enums.PlacementVerdict;
import com.mouse.smartbet.enums.RiskLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Advisory stake for one account and one selection. Producing it never touches the ledger.
 */
@Value
@Builder
public class StakeRecommendation {
    Long accountId;
    String predictionId;
    Outcome outcome;
    double odds;
    double winProbability;

    BigDecimal recommendedStake;
    double stakePercentage;
    BigDecimal maxStakeAllowed;
    String strategy;

    KellyResult kelly;

    RiskLevel riskLevel;
    @Singular
    List<String> riskFactors;
    String riskExplanation;

    /** what the ledger would answer right now for recommendedStake */
    PlacementVerdict placementVerdict;

    @Singular
    List<String> warnings;

    Instant createdAt;

    public boolean isPlaceable() {
        return placementVerdict != null && placementVerdict.isAllowed();
    }
}
