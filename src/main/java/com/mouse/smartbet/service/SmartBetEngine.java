package com.mouse.smartbet.service;

import com.mouse.smartbet.entity.BankrollAccount;
import com.mouse.smartbet.entity.BetTransaction;
import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.finance.BankrollLedger;
import com.mouse.smartbet.finance.BetTransactionMachine;
import com.mouse.smartbet.model.BatchPredictionResult;
import com.mouse.smartbet.model.OpenAccountRequest;
import com.mouse.smartbet.model.PlaceBetRequest;
import com.mouse.smartbet.model.PredictionRecord;
import com.mouse.smartbet.model.StakeRecommendation;
import com.mouse.smartbet.model.StakeRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Entry point for callers such as an HTTP layer. Domain exceptions pass through unchanged.
 */
@Service
@RequiredArgsConstructor
public class SmartBetEngine {

    private final PredictionService predictionService;
    private final StakeRecommendationService stakeRecommendationService;
    private final BankrollLedger ledger;
    private final BetTransactionMachine transactionMachine;

    public PredictionRecord predict(String leagueName, Map<String, ?> matchAttributes) {
        return predictionService.predict(leagueName, matchAttributes);
    }

    public BatchPredictionResult predictBatch(List<? extends Map<String, ?>> matches) {
        return predictionService.predictBatch(matches);
    }

    public BankrollAccount openAccount(OpenAccountRequest request) {
        return ledger.openAccount(request);
    }

    public BankrollAccount getAccount(Long accountId) {
        return ledger.getAccount(accountId);
    }

    public StakeRecommendation recommendStake(Long accountId, PredictionRecord prediction) {
        return stakeRecommendationService.recommend(accountId, StakeRequest.fromPrediction(prediction));
    }

    public StakeRecommendation recommendStake(Long accountId, StakeRequest request) {
        return stakeRecommendationService.recommend(accountId, request);
    }

    public BetTransaction placeBet(Long accountId, Outcome outcome, BigDecimal odds, BigDecimal stake) {
        return transactionMachine.place(PlaceBetRequest.of(accountId, outcome, odds, stake));
    }

    public BetTransaction placeBet(PlaceBetRequest request) {
        return transactionMachine.place(request);
    }

    /**
     * Place the stake of an earlier recommendation, keeping the prediction reference.
     */
    public BetTransaction placeRecommended(PredictionRecord prediction, StakeRecommendation recommendation) {
        return transactionMachine.place(PlaceBetRequest.builder()
                .accountId(recommendation.getAccountId())
                .outcome(prediction.getOutcome())
                .odds(BigDecimal.valueOf(prediction.getSelectedOdds()))
                .stake(recommendation.getRecommendedStake())
                .predictionId(prediction.getPredictionId())
                .leagueKey(prediction.getLeagueKey())
                .matchDescription(prediction.getHomeTeam() + " vs " + prediction.getAwayTeam())
                .recommendedStake(recommendation.getRecommendedStake())
                .strategyUsed(recommendation.getStrategy())
                .build());
    }

    public BetTransaction settleBet(Long transactionId, boolean won, boolean isVoid) {
        return transactionMachine.settle(transactionId, won, isVoid);
    }

    public List<BetTransaction> history(Long accountId) {
        return transactionMachine.history(accountId);
    }

    public List<BetTransaction> pendingBets(Long accountId) {
        return transactionMachine.pendingBets(accountId);
    }
}
