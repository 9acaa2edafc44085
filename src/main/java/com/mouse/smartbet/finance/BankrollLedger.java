package com.mouse.smartbet.finance;

import com.mouse.smartbet.config.SmartBetProperties;
import com.mouse.smartbet.entity.BankrollAccount;
import com.mouse.smartbet.enums.BetStatus;
import com.mouse.smartbet.enums.PlacementVerdict;
import com.mouse.smartbet.enums.RiskProfile;
import com.mouse.smartbet.exception.AccountNotFoundException;
import com.mouse.smartbet.exception.InsufficientBankrollException;
import com.mouse.smartbet.exception.InvalidInputException;
import com.mouse.smartbet.logservice.BetFlowLogger;
import com.mouse.smartbet.model.OpenAccountRequest;
import com.mouse.smartbet.model.PlacementCheck;
import com.mouse.smartbet.repository.BankrollAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Balance, loss limits and loss windows of a bankroll account.
 *
 * The mutators ({@link #checkAndResetWindows}, {@link #debit}, {@link #credit}, {@link #recordSettlement})
 * work on a managed entity and expect the caller to hold the account lock inside an open
 * transaction. {@link BetTransactionMachine} is the only caller that does.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BankrollLedger {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final double MAX_STAKE_PERCENTAGE_CEILING = 25.0;

    private final BankrollAccountRepository accountRepository;
    private final SmartBetProperties properties;
    private final BetFlowLogger flowLogger;
    private final Clock clock;

    /**
     * Open a bankroll account. Unset fields are filled from the risk profile.
     *
     * @throws InvalidInputException if the owner already has an account or a value is out of range
     */
    @Transactional
    public BankrollAccount openAccount(OpenAccountRequest request) {
        if (request == null || request.getOwnerId() == null || request.getOwnerId().isBlank()) {
            throw new InvalidInputException("Owner id is required");
        }
        BigDecimal initial = request.getInitialBankroll();
        if (initial == null || initial.signum() <= 0) {
            throw new InvalidInputException("Initial bankroll must be positive, got " + initial);
        }
        if (accountRepository.existsByOwnerId(request.getOwnerId())) {
            throw new InvalidInputException("Bankroll account already exists for owner " + request.getOwnerId());
        }

        RiskProfile profile = request.getRiskProfile() != null ? request.getRiskProfile() : RiskProfile.BALANCED;
        double maxPct = request.getMaxStakePercentage() != null
                ? request.getMaxStakePercentage() : profile.getMaxStakePercentage();
        if (!(maxPct > 0 && maxPct <= MAX_STAKE_PERCENTAGE_CEILING)) {
            throw new InvalidInputException("Max stake percentage must be in (0, 25], got " + maxPct);
        }
        double kellyFraction = request.getKellyFraction() != null
                ? request.getKellyFraction() : profile.getKellyFraction();
        if (!(kellyFraction > 0 && kellyFraction <= 1.0)) {
            throw new InvalidInputException("Kelly fraction must be in (0, 1], got " + kellyFraction);
        }
        if (request.getFixedStakeAmount() != null && request.getFixedStakeAmount().signum() <= 0) {
            throw new InvalidInputException("Fixed stake amount must be positive, got " + request.getFixedStakeAmount());
        }
        Double fixedPct = request.getFixedStakePercentage();
        if (fixedPct != null && !(fixedPct > 0 && fixedPct <= 100)) {
            throw new InvalidInputException("Fixed stake percentage must be in (0, 100], got " + fixedPct);
        }

        BigDecimal scaledInitial = initial.setScale(2, RoundingMode.HALF_UP);
        Instant now = clock.instant();
        BankrollAccount account = BankrollAccount.builder()
                .ownerId(request.getOwnerId())
                .currency(request.getCurrency() != null ? request.getCurrency() : "USD")
                .initialBankroll(scaledInitial)
                .currentBankroll(scaledInitial)
                .riskProfile(profile)
                .strategy(request.getStrategy() != null ? request.getStrategy() : profile.getRecommendedStrategy())
                .maxStakePercentage(maxPct)
                .kellyFraction(kellyFraction)
                .fixedStakeAmount(request.getFixedStakeAmount())
                .fixedStakePercentage(request.getFixedStakePercentage())
                .dailyLossLimit(request.getDailyLossLimit() != null
                        ? request.getDailyLossLimit() : percentOf(scaledInitial, profile.getDailyLossLimitPct()))
                .weeklyLossLimit(request.getWeeklyLossLimit() != null
                        ? request.getWeeklyLossLimit() : percentOf(scaledInitial, profile.getWeeklyLossLimitPct()))
                .dailyWindowStart(now)
                .weeklyWindowStart(now)
                .createdAt(now)
                .lastUpdated(now)
                .build();

        BankrollAccount saved = accountRepository.save(account);
        flowLogger.logAccountOpened(saved);
        return saved;
    }

    @Transactional(readOnly = true)
    public BankrollAccount getAccount(Long accountId) {
        if (accountId == null) {
            throw new InvalidInputException("Account id is required");
        }
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public Optional<BankrollAccount> findByOwner(String ownerId) {
        return accountRepository.findByOwnerId(ownerId);
    }

    /**
     * Clear loss aggregates whose window has elapsed. The window start advances by whole periods,
     * so calling this again for the same instant changes nothing.
     *
     * @return true if at least one window was reset
     */
    public boolean checkAndResetWindows(BankrollAccount account, Instant now) {
        SmartBetProperties.Ledger cfg = properties.getLedger();
        boolean reset = false;

        Instant dailyStart = account.getDailyWindowStart();
        if (isExpired(dailyStart, cfg.getDailyWindow(), now)) {
            Instant next = advance(dailyStart, cfg.getDailyWindow(), now);
            flowLogger.logWindowReset(account.getId(), "Daily", account.getDailyLossAmount(), next);
            account.setDailyLossAmount(zero());
            account.setDailyWindowStart(next);
            reset = true;
        }

        Instant weeklyStart = account.getWeeklyWindowStart();
        if (isExpired(weeklyStart, cfg.getWeeklyWindow(), now)) {
            Instant next = advance(weeklyStart, cfg.getWeeklyWindow(), now);
            flowLogger.logWindowReset(account.getId(), "Weekly", account.getWeeklyLossAmount(), next);
            account.setWeeklyLossAmount(zero());
            account.setWeeklyWindowStart(next);
            reset = true;
        }

        if (reset) {
            account.setLastUpdated(now);
        }
        return reset;
    }

    /**
     * Decide whether {@code stake} may be placed at {@code now}. Does not modify the account: an
     * elapsed window counts as already reset.
     *
     * Hard refusals, in order: non-positive stake, stake above current bankroll, daily loss limit,
     * weekly loss limit, stake above max_stake_percentage of current bankroll.
     */
    public PlacementCheck canPlace(BankrollAccount account, BigDecimal stake, Instant now) {
        if (stake == null || stake.signum() <= 0) {
            return PlacementCheck.refused(PlacementVerdict.INVALID_STAKE, "Stake must be positive");
        }
        BigDecimal current = account.getCurrentBankroll();
        if (stake.compareTo(current) > 0) {
            return PlacementCheck.refused(PlacementVerdict.INSUFFICIENT_BANKROLL,
                    "Insufficient bankroll: stake " + stake + " exceeds available " + current);
        }

        BigDecimal dailyRemaining = remaining(account.getDailyLossLimit(), effectiveDailyLoss(account, now));
        if (dailyRemaining != null && stake.compareTo(dailyRemaining) > 0) {
            return PlacementCheck.refused(PlacementVerdict.DAILY_LOSS_LIMIT,
                    "Daily loss limit reached: stake " + stake + " exceeds remaining " + dailyRemaining);
        }

        BigDecimal weeklyRemaining = remaining(account.getWeeklyLossLimit(), effectiveWeeklyLoss(account, now));
        if (weeklyRemaining != null && stake.compareTo(weeklyRemaining) > 0) {
            return PlacementCheck.refused(PlacementVerdict.WEEKLY_LOSS_LIMIT,
                    "Weekly loss limit reached: stake " + stake + " exceeds remaining " + weeklyRemaining);
        }

        BigDecimal maxStake = maxStake(account);
        if (stake.compareTo(maxStake) > 0) {
            return PlacementCheck.refused(PlacementVerdict.MAX_STAKE_EXCEEDED,
                    "Stake exceeds maximum (" + account.getMaxStakePercentage() + "% of bankroll = " + maxStake + ")");
        }

        return PlacementCheck.allowed(warnings(account, stake, dailyRemaining, weeklyRemaining));
    }

    /**
     * @throws InsufficientBankrollException if the stake exceeds the current bankroll
     */
    public void debit(BankrollAccount account, BigDecimal stake, Instant now) {
        if (stake == null || stake.signum() <= 0) {
            throw new InvalidInputException("Debit amount must be positive, got " + stake);
        }
        BigDecimal before = account.getCurrentBankroll();
        if (!account.hasSufficientBankroll(stake)) {
            throw new InsufficientBankrollException(stake, before);
        }
        account.setCurrentBankroll(before.subtract(stake));
        account.setTotalBetsPlaced(account.getTotalBetsPlaced() + 1);
        account.setLastUpdated(now);
        log.debug("Debited {} from account {}: {} -> {}", stake, account.getId(), before, account.getCurrentBankroll());
    }

    public void credit(BankrollAccount account, BigDecimal amount, Instant now) {
        if (amount == null || amount.signum() < 0) {
            throw new InvalidInputException("Credit amount must not be negative, got " + amount);
        }
        BigDecimal before = account.getCurrentBankroll();
        account.setCurrentBankroll(before.add(amount));
        account.setLastUpdated(now);
        log.debug("Credited {} to account {}: {} -> {}", amount, account.getId(), before, account.getCurrentBankroll());
    }

    /**
     * Fold a settlement into statistics and loss aggregates. Void bets leave both untouched.
     */
    public void recordSettlement(BankrollAccount account, BigDecimal stake, BigDecimal profitLoss, BetStatus outcome) {
        if (outcome == BetStatus.VOID) {
            return;
        }
        account.setTotalWagered(account.getTotalWagered().add(stake));
        account.setTotalProfitLoss(account.getTotalProfitLoss().add(profitLoss));
        if (outcome == BetStatus.SETTLED_WON) {
            account.setTotalBetsWon(account.getTotalBetsWon() + 1);
        } else {
            account.setTotalBetsLost(account.getTotalBetsLost() + 1);
        }
        if (profitLoss.signum() < 0) {
            BigDecimal loss = profitLoss.negate();
            account.setDailyLossAmount(account.getDailyLossAmount().add(loss));
            account.setWeeklyLossAmount(account.getWeeklyLossAmount().add(loss));
        }
    }

    /** max_stake_percentage of current bankroll, rounded down to cents */
    public BigDecimal maxStake(BankrollAccount account) {
        return account.getCurrentBankroll()
                .multiply(BigDecimal.valueOf(account.getMaxStakePercentage()))
                .divide(HUNDRED, 2, RoundingMode.DOWN);
    }

    public BigDecimal effectiveDailyLoss(BankrollAccount account, Instant now) {
        return isExpired(account.getDailyWindowStart(), properties.getLedger().getDailyWindow(), now)
                ? zero() : account.getDailyLossAmount();
    }

    public BigDecimal effectiveWeeklyLoss(BankrollAccount account, Instant now) {
        return isExpired(account.getWeeklyWindowStart(), properties.getLedger().getWeeklyWindow(), now)
                ? zero() : account.getWeeklyLossAmount();
    }

    public Instant now() {
        return clock.instant();
    }

    private List<String> warnings(BankrollAccount account, BigDecimal stake,
                                  BigDecimal dailyRemaining, BigDecimal weeklyRemaining) {
        SmartBetProperties.Ledger cfg = properties.getLedger();
        List<String> warnings = new ArrayList<>();

        if (dailyRemaining != null
                && stake.compareTo(dailyRemaining.multiply(BigDecimal.valueOf(cfg.getDailyAllowanceWarningShare()))) > 0) {
            warnings.add(String.format("Bet uses >%.0f%% of remaining daily loss limit ($%s left)",
                    cfg.getDailyAllowanceWarningShare() * 100, dailyRemaining.toPlainString()));
        }
        if (weeklyRemaining != null
                && stake.compareTo(weeklyRemaining.multiply(BigDecimal.valueOf(cfg.getWeeklyAllowanceWarningShare()))) > 0) {
            warnings.add(String.format("Bet uses >%.0f%% of remaining weekly loss limit ($%s left)",
                    cfg.getWeeklyAllowanceWarningShare() * 100, weeklyRemaining.toPlainString()));
        }

        BigDecimal current = account.getCurrentBankroll();
        if (current.signum() > 0) {
            double pct = stake.multiply(HUNDRED).divide(current, 4, RoundingMode.HALF_UP).doubleValue();
            if (pct > cfg.getSingleBetWarningPct()) {
                warnings.add(String.format("Warning: Betting %.1f%% of total bankroll on single bet", pct));
            }
        }

        BigDecimal floor = account.getInitialBankroll().multiply(BigDecimal.valueOf(cfg.getDrawdownWarningRatio()));
        if (current.compareTo(floor) < 0) {
            warnings.add(String.format("Bankroll down >%.0f%% from initial - consider reducing stakes",
                    (1 - cfg.getDrawdownWarningRatio()) * 100));
        }
        return warnings;
    }

    private static BigDecimal remaining(BigDecimal limit, BigDecimal used) {
        if (limit == null) return null;
        return limit.subtract(used).max(BigDecimal.ZERO);
    }

    static boolean isExpired(Instant windowStart, Duration period, Instant now) {
        return windowStart == null || !now.isBefore(windowStart.plus(period));
    }

    /** Latest window boundary at or before now. */
    static Instant advance(Instant windowStart, Duration period, Instant now) {
        if (windowStart == null) return now;
        long elapsed = Duration.between(windowStart, now).toMillis();
        long periods = elapsed / period.toMillis();
        return windowStart.plus(period.multipliedBy(periods));
    }

    private static BigDecimal percentOf(BigDecimal amount, double pct) {
        return amount.multiply(BigDecimal.valueOf(pct)).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2);
    }
}
