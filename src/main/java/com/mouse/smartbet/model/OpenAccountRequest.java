package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.RiskProfile;
import com.mouse.smartbet.enums.StakingStrategy;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * New bankroll account. Anything left null is taken from the risk profile.
 */
@Value
@Builder
public class OpenAccountRequest {
    String ownerId;
    @Builder.Default
    String currency = "USD";
    BigDecimal initialBankroll;
    @Builder.Default
    RiskProfile riskProfile = RiskProfile.BALANCED;

    StakingStrategy strategy;
    Double maxStakePercentage;
    Double kellyFraction;
    BigDecimal fixedStakeAmount;
    Double fixedStakePercentage;
    BigDecimal dailyLossLimit;
    BigDecimal weeklyLossLimit;
}
