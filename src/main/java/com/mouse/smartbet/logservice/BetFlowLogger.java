package com.mouse.smartbet.logservice;

import com.mouse.smartbet.entity.BankrollAccount;
import com.mouse.smartbet.entity.BetTransaction;
import com.mouse.smartbet.enums.BetStatus;
import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.enums.PlacementVerdict;
import com.mouse.smartbet.model.StakeRecommendation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Centralized logger for bet lifecycle events.
 * One line per event, pipe-separated context, so a single account can be followed with grep.
 */
@Slf4j
@Component
public class BetFlowLogger {

    private static final String EMOJI_START = "🎯";
    private static final String EMOJI_BET = "💰";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_SYNC = "🔄";
    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_CLOCK = "⏰";
    private static final String EMOJI_ERROR = "❌";
    private static final String EMOJI_NEW = "🆕";
    private static final String EMOJI_PARTY = "🎉";
    private static final String EMOJI_CHART = "📈";

    // ==========================================
    // ACCOUNTS
    // ==========================================

    public void logAccountOpened(BankrollAccount account) {
        log.info("{} Opened bankroll account | AccountId: {} | Owner: {} | Bankroll: {} {} | Profile: {} | Strategy: {} | MaxStake: {}%",
                EMOJI_NEW, account.getId(), account.getOwnerId(), account.getInitialBankroll(), account.getCurrency(),
                account.getRiskProfile(), account.getStrategy().getCode(), account.getMaxStakePercentage());
    }

    public void logWindowReset(Long accountId, String window, BigDecimal clearedLoss, Instant newStart) {
        log.info("{} {} {} loss window reset | AccountId: {} | Cleared: {} | WindowStart: {}",
                EMOJI_CLOCK, EMOJI_SYNC, window, accountId, clearedLoss, newStart);
    }

    // ==========================================
    // STAKE RECOMMENDATION
    // ==========================================

    public void logStakeRecommendation(Long accountId, StakeRecommendation recommendation) {
        log.info("{} Stake recommended | AccountId: {} | Outcome: {} | Odds: {} | Stake: {} ({}%) | Strategy: {} | Risk: {}",
                EMOJI_CHART, accountId, recommendation.getOutcome(), recommendation.getOdds(),
                recommendation.getRecommendedStake(), String.format("%.2f", recommendation.getStakePercentage()),
                recommendation.getStrategy(), recommendation.getRiskLevel());
        if (!recommendation.getWarnings().isEmpty()) {
            log.info("{} Stake warnings | AccountId: {} | {}", EMOJI_WARNING, accountId,
                    String.join(" | ", recommendation.getWarnings()));
        }
    }

    // ==========================================
    // BET PLACEMENT
    // ==========================================

    public void logPlacementStart(Long accountId, Outcome outcome, BigDecimal odds, BigDecimal stake) {
        log.info("{} {} Starting bet placement | AccountId: {} | Outcome: {} | Odds: {} | Stake: {}",
                EMOJI_START, EMOJI_BET, accountId, outcome, odds, stake);
    }

    public void logPlacementRefused(Long accountId, BigDecimal stake, PlacementVerdict verdict, String reason) {
        log.warn("{} {} Placement refused | AccountId: {} | Stake: {} | Verdict: {} | Reason: {}",
                EMOJI_WARNING, EMOJI_BET, accountId, stake, verdict, reason);
    }

    public void logPlacementWarnings(Long accountId, List<String> warnings) {
        if (warnings == null || warnings.isEmpty()) return;
        log.warn("{} Placement allowed with warnings | AccountId: {} | {}",
                EMOJI_WARNING, accountId, String.join(" | ", warnings));
    }

    public void logBetPlaced(Long accountId, BetTransaction tx, BigDecimal bankrollAfterDebit) {
        log.info("{} {} Bet placed | AccountId: {} | TxId: {} | Outcome: {} | Odds: {} | Stake: {} | Bankroll: {} -> {}",
                EMOJI_SUCCESS, EMOJI_BET, accountId, tx.getId(), tx.getSelectedOutcome(), tx.getOdds(),
                tx.getStake(), tx.getBankrollBefore(), bankrollAfterDebit);
    }

    public void logPlacementException(Long accountId, Exception e) {
        log.error("{} {} Exception during bet placement | AccountId: {} | Error: {}",
                EMOJI_ERROR, EMOJI_BET, accountId, e.getMessage(), e);
    }

    // ==========================================
    // SETTLEMENT
    // ==========================================

    public void logBetSettled(Long accountId, BetTransaction tx) {
        String emoji = tx.getStatus() == BetStatus.SETTLED_WON ? EMOJI_PARTY : EMOJI_SUCCESS;
        log.info("{} Bet settled | AccountId: {} | TxId: {} | Status: {} | Stake: {} | P/L: {} | Credited: {} | Bankroll: {}",
                emoji, accountId, tx.getId(), tx.getStatus(), tx.getStake(), tx.getProfitLoss(),
                tx.getActualReturn(), tx.getBankrollAfter());
    }

    public void logAlreadySettled(Long txId, BetStatus status) {
        log.warn("{} {} Duplicate settlement rejected | TxId: {} | Status: {}",
                EMOJI_ERROR, EMOJI_SYNC, txId, status);
    }
}
