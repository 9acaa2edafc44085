package com.mouse.smartbet.finance;

import com.mouse.smartbet.entity.BankrollAccount;
import com.mouse.smartbet.entity.BetTransaction;
import com.mouse.smartbet.enums.BetStatus;
import com.mouse.smartbet.exception.AccountNotFoundException;
import com.mouse.smartbet.exception.AlreadySettledException;
import com.mouse.smartbet.exception.InsufficientBankrollException;
import com.mouse.smartbet.exception.InvalidInputException;
import com.mouse.smartbet.exception.InvalidOddsException;
import com.mouse.smartbet.exception.LimitExceededException;
import com.mouse.smartbet.exception.SmartBetException;
import com.mouse.smartbet.exception.TransactionNotFoundException;
import com.mouse.smartbet.logservice.BetFlowLogger;
import com.mouse.smartbet.model.PlaceBetRequest;
import com.mouse.smartbet.model.PlacementCheck;
import com.mouse.smartbet.repository.BankrollAccountRepository;
import com.mouse.smartbet.repository.BetTransactionRepository;
import com.mouse.smartbet.service.EngineMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Bet lifecycle: PENDING -> SETTLED_WON | SETTLED_LOST | VOID, exactly once.
 *
 * Each placement and settlement is one unit of work: account lock, then a database transaction
 * that re-reads the account row under a write lock, resets elapsed loss windows, mutates the
 * ledger and writes the transaction row. The account lock is released after commit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BetTransactionMachine {

    private final BankrollAccountRepository accountRepository;
    private final BetTransactionRepository transactionRepository;
    private final BankrollLedger ledger;
    private final AccountLockRegistry lockRegistry;
    private final TransactionTemplate transactionTemplate;
    private final BetFlowLogger flowLogger;
    private final EngineMetricsService metricsService;

    /**
     * Create a pending transaction and debit the stake.
     *
     * @throws InsufficientBankrollException if the stake is above the current bankroll
     * @throws LimitExceededException        if a loss limit or the max stake percentage would be breached
     * @throws AccountNotFoundException      if the account does not exist
     */
    public BetTransaction place(PlaceBetRequest request) {
        validate(request);
        Long accountId = request.getAccountId();
        BigDecimal stake = request.getStake().setScale(2, RoundingMode.HALF_UP);

        flowLogger.logPlacementStart(accountId, request.getOutcome(), request.getOdds(), stake);
        metricsService.recordPlacementAttempt();

        Attempt attempt;
        try {
            attempt = lockRegistry.withLock(accountId,
                    () -> transactionTemplate.execute(status -> doPlace(request, stake)));
        } catch (RuntimeException e) {
            if (!(e instanceof SmartBetException)) {
                flowLogger.logPlacementException(accountId, e);
            }
            throw e;
        }

        if (attempt == null) {
            throw new IllegalStateException("Placement for account " + accountId + " produced no result");
        }

        PlacementCheck check = attempt.check();
        if (!check.isAllowed()) {
            metricsService.recordRefusal();
            flowLogger.logPlacementRefused(accountId, stake, check.getVerdict(), check.getReason());
            throw refusal(check, stake, attempt.available());
        }

        metricsService.recordPlacement();
        flowLogger.logPlacementWarnings(accountId, check.getWarnings());
        flowLogger.logBetPlaced(accountId, attempt.transaction(), attempt.available());
        return attempt.transaction();
    }

    /**
     * Settle a pending transaction. {@code isVoid} wins over {@code won}.
     *
     * @throws AlreadySettledException      if the transaction is no longer pending
     * @throws TransactionNotFoundException if the transaction does not exist
     */
    public BetTransaction settle(Long transactionId, boolean won, boolean isVoid) {
        if (transactionId == null) {
            throw new InvalidInputException("Transaction id is required");
        }
        Long accountId = transactionRepository.findAccountIdById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));

        BetTransaction settled;
        try {
            settled = lockRegistry.withLock(accountId,
                    () -> transactionTemplate.execute(status -> doSettle(accountId, transactionId, won, isVoid)));
        } catch (AlreadySettledException e) {
            metricsService.recordDuplicateSettlement();
            flowLogger.logAlreadySettled(transactionId, e.getCurrentStatus());
            throw e;
        }

        metricsService.recordSettlement();
        flowLogger.logBetSettled(accountId, settled);
        return settled;
    }

    @Transactional(readOnly = true)
    public BetTransaction getTransaction(Long transactionId) {
        return transactionRepository.findById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<BetTransaction> history(Long accountId) {
        return transactionRepository.findByAccount_IdOrderByCreatedAtDesc(accountId);
    }

    @Transactional(readOnly = true)
    public List<BetTransaction> pendingBets(Long accountId) {
        return transactionRepository.findByAccount_IdAndStatus(accountId, BetStatus.PENDING);
    }

    /**
     * void ? 0 : won ? stake * (odds - 1) : -stake, in cents
     */
    public static BigDecimal profitLoss(BigDecimal stake, BigDecimal odds, boolean won, boolean isVoid) {
        if (isVoid) {
            return BigDecimal.ZERO.setScale(2);
        }
        if (won) {
            return stake.multiply(odds.subtract(BigDecimal.ONE)).setScale(2, RoundingMode.HALF_UP);
        }
        return stake.negate().setScale(2, RoundingMode.HALF_UP);
    }

    private Attempt doPlace(PlaceBetRequest request, BigDecimal stake) {
        Long accountId = request.getAccountId();
        BankrollAccount account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));

        Instant now = ledger.now();
        ledger.checkAndResetWindows(account, now);

        PlacementCheck check = ledger.canPlace(account, stake, now);
        if (!check.isAllowed()) {
            // window resets above still commit
            accountRepository.save(account);
            return new Attempt(null, check, account.getCurrentBankroll());
        }

        BigDecimal before = account.getCurrentBankroll();
        ledger.debit(account, stake, now);

        BetTransaction tx = BetTransaction.builder()
                .account(account)
                .predictionId(request.getPredictionId())
                .leagueKey(request.getLeagueKey())
                .matchDescription(request.getMatchDescription())
                .selectedOutcome(request.getOutcome())
                .odds(request.getOdds())
                .stake(stake)
                .potentialReturn(stake.multiply(request.getOdds()).setScale(2, RoundingMode.HALF_UP))
                .status(BetStatus.PENDING)
                .bankrollBefore(before)
                .recommendedStake(request.getRecommendedStake())
                .strategyUsed(request.getStrategyUsed())
                .createdAt(now)
                .build();

        BetTransaction saved = transactionRepository.save(tx);
        accountRepository.save(account);
        return new Attempt(saved, check, account.getCurrentBankroll());
    }

    private BetTransaction doSettle(Long accountId, Long transactionId, boolean won, boolean isVoid) {
        BetTransaction tx = transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));

        BetStatus next = isVoid ? BetStatus.VOID : (won ? BetStatus.SETTLED_WON : BetStatus.SETTLED_LOST);
        if (!tx.getStatus().canTransitionTo(next)) {
            throw new AlreadySettledException(transactionId, tx.getStatus());
        }

        BankrollAccount account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));

        Instant now = ledger.now();
        ledger.checkAndResetWindows(account, now);

        BigDecimal profitLoss = profitLoss(tx.getStake(), tx.getOdds(), won, isVoid);
        BigDecimal credited = tx.getStake().add(profitLoss);

        ledger.credit(account, credited, now);
        ledger.recordSettlement(account, tx.getStake(), profitLoss, next);

        tx.setStatus(next);
        tx.setProfitLoss(profitLoss);
        tx.setActualReturn(credited);
        tx.setBankrollAfter(account.getCurrentBankroll());
        tx.setSettledAt(now);

        accountRepository.save(account);
        return transactionRepository.save(tx);
    }

    private static void validate(PlaceBetRequest request) {
        if (request == null || request.getAccountId() == null) {
            throw new InvalidInputException("Account id is required");
        }
        if (request.getOutcome() == null) {
            throw new InvalidInputException("Selected outcome is required");
        }
        if (request.getOdds() == null || request.getOdds().compareTo(BigDecimal.ONE) <= 0) {
            throw new InvalidOddsException("Odds must be > 1.0, got " + request.getOdds());
        }
        if (request.getStake() == null || request.getStake().signum() <= 0) {
            throw new InvalidInputException("Stake must be positive, got " + request.getStake());
        }
    }

    private static SmartBetException refusal(PlacementCheck check, BigDecimal stake, BigDecimal available) {
        return switch (check.getVerdict()) {
            case INSUFFICIENT_BANKROLL -> new InsufficientBankrollException(stake, available);
            case INVALID_STAKE -> new InvalidInputException(check.getReason());
            default -> new LimitExceededException(check.getVerdict(), check.getReason());
        };
    }

    private record Attempt(BetTransaction transaction, PlacementCheck check, BigDecimal available) {
    }
}
