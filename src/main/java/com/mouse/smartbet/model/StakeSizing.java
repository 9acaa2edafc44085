package com.mouse.smartbet.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of one StakeSizer call. stakeAmount never exceeds maxStakeAllowed.
 */
@Value
@Builder(toBuilder = true)
public class StakeSizing {
    BigDecimal stakeAmount;
    /** stakeAmount / bankroll * 100 */
    double stakePercentage;
    /** strategy output before the cap */
    BigDecimal rawStake;
    BigDecimal maxStakeAllowed;

    String strategyCode;
    boolean fallbackApplied;
    boolean clamped;

    /** null for non-Kelly strategies */
    KellyResult kelly;
    RiskAssessment risk;

    @Singular
    List<String> warnings;

    public boolean hasStake() {
        return stakeAmount != null && stakeAmount.signum() > 0;
    }
}
