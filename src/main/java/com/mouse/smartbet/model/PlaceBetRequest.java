package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.Outcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PlaceBetRequest {
    Long accountId;
    Outcome outcome;
    BigDecimal odds;
    BigDecimal stake;

    // optional context
    String predictionId;
    String leagueKey;
    String matchDescription;
    BigDecimal recommendedStake;
    String strategyUsed;

    public static PlaceBetRequest of(Long accountId, Outcome outcome, BigDecimal odds, BigDecimal stake) {
        return PlaceBetRequest.builder()
                .accountId(accountId)
                .outcome(outcome)
                .odds(odds)
                .stake(stake)
                .build();
    }
}
