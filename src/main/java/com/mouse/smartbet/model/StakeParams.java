package com.mouse.smartbet.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Per-account strategy parameters. Null fields fall back to the configured staking defaults.
 */
@Value
@Builder(toBuilder = true)
public class StakeParams {
    Double kellyFraction;
    Double fixedPercentage;
    BigDecimal fixedAmount;

    public static StakeParams defaults() {
        return StakeParams.builder().build();
    }
}
