package com.mouse.smartbet.service;

import com.mouse.smartbet.config.SmartBetProperties;
import com.mouse.smartbet.enums.StakingStrategy;
import com.mouse.smartbet.exception.InvalidInputException;
import com.mouse.smartbet.exception.InvalidOddsException;
import com.mouse.smartbet.model.KellyResult;
import com.mouse.smartbet.model.OddsTriple;
import com.mouse.smartbet.model.RiskAssessment;
import com.mouse.smartbet.model.StakeParams;
import com.mouse.smartbet.model.StakeSizing;
import com.mouse.smartbet.utils.KellyCalculator;
import com.mouse.smartbet.utils.OddsMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Strategy dispatch plus the hard cap.
 *
 * The strategy produces a raw stake (rounded half-up to cents), which is then clamped to
 * max_stake_percentage of bankroll (rounded down to cents). A warning is added exactly when the
 * clamp fires. Unknown strategy codes size at the configured fallback percentage and say so.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StakeSizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SmartBetProperties properties;
    private final RiskClassifier riskClassifier;

    public StakeSizing size(BigDecimal bankroll,
                            String strategyCode,
                            double winProbability,
                            double odds,
                            double confidencePct,
                            StakeParams params,
                            double maxStakePercentage) {
        if (!OddsTriple.isValidOdds(odds)) {
            throw new InvalidOddsException("Selected odds must be > 1.0, got " + odds);
        }
        if (!(maxStakePercentage > 0 && maxStakePercentage <= 100)) {
            throw new InvalidInputException("Max stake percentage must be in (0, 100], got " + maxStakePercentage);
        }
        StakeParams p = params != null ? params : StakeParams.defaults();
        SmartBetProperties.Staking cfg = properties.getStaking();

        if (bankroll == null || bankroll.signum() <= 0) {
            log.warn("Cannot size stake without bankroll: {}", bankroll);
            return zero(strategyCode, BigDecimal.ZERO.setScale(2), null, "No bankroll available");
        }

        BigDecimal maxStake = bankroll.multiply(BigDecimal.valueOf(maxStakePercentage))
                .divide(HUNDRED, 2, RoundingMode.DOWN);
        List<String> warnings = new ArrayList<>();

        Optional<StakingStrategy> resolved = StakingStrategy.fromCode(strategyCode);
        KellyResult kelly = null;
        BigDecimal rawStake;
        boolean fallback = false;

        if (resolved.isEmpty()) {
            fallback = true;
            double pct = cfg.getFallbackPercentage();
            warnings.add(String.format("Unknown staking strategy '%s' - using fixed %.1f%% fallback", strategyCode, pct));
            log.warn("⚠️ Unknown staking strategy '{}', falling back to {}% of bankroll", strategyCode, pct);
            rawStake = percentOf(bankroll, pct);
        } else {
            switch (resolved.get()) {
                case KELLY -> {
                    kelly = KellyCalculator.kelly(winProbability, odds, false, 1.0);
                    if (!kelly.positiveEdge()) {
                        return zero(strategyCode, maxStake, kelly, kelly.reason());
                    }
                    warnings.add("Full Kelly is aggressive - consider Fractional Kelly");
                    rawStake = fractionOf(bankroll, kelly.full());
                }
                case KELLY_FRACTIONAL -> {
                    double fraction = p.getKellyFraction() != null ? p.getKellyFraction() : cfg.getDefaultKellyFraction();
                    kelly = KellyCalculator.kelly(winProbability, odds, true, fraction);
                    if (!kelly.positiveEdge()) {
                        return zero(strategyCode, maxStake, kelly, kelly.reason());
                    }
                    rawStake = fractionOf(bankroll, kelly.fractional());
                }
                case FIXED_PERCENTAGE -> {
                    double pct = p.getFixedPercentage() != null ? p.getFixedPercentage() : cfg.getDefaultFixedPercentage();
                    if (!(pct >= 0)) {
                        throw new InvalidInputException("Fixed stake percentage must not be negative, got " + pct);
                    }
                    rawStake = percentOf(bankroll, pct);
                }
                case FIXED_AMOUNT -> {
                    BigDecimal amount = p.getFixedAmount() != null ? p.getFixedAmount() : cfg.getDefaultFixedAmount();
                    if (amount.signum() < 0) {
                        throw new InvalidInputException("Fixed stake amount must not be negative, got " + amount);
                    }
                    rawStake = amount.setScale(2, RoundingMode.HALF_UP);
                }
                case CONFIDENCE_SCALED -> {
                    double pct = confidenceScaledPercentage(confidencePct);
                    if (pct <= 0) {
                        return zero(strategyCode, maxStake, null, "Confidence too low for betting");
                    }
                    rawStake = percentOf(bankroll, pct);
                }
                default -> throw new IllegalStateException("Unhandled strategy " + resolved.get());
            }
        }

        BigDecimal stake = rawStake;
        boolean clamped = false;
        if (rawStake.compareTo(maxStake) > 0) {
            clamped = true;
            stake = maxStake;
            warnings.add(String.format("Stake reduced from $%s to $%s (max %.1f%% limit)",
                    rawStake.toPlainString(), maxStake.toPlainString(), maxStakePercentage));
        }

        double stakePct = stake.multiply(HUNDRED).divide(bankroll, 6, RoundingMode.HALF_UP).doubleValue();
        RiskAssessment risk = stake.signum() > 0
                ? riskClassifier.classify(stakePct, confidencePct, odds, OddsMath.edge(winProbability, odds))
                : RiskAssessment.none("zero stake");

        log.debug("Sized stake: strategy={} bankroll={} raw={} stake={} ({}%) clamped={} risk={}",
                strategyCode, bankroll, rawStake, stake, stakePct, clamped, risk.getLevel());

        return StakeSizing.builder()
                .stakeAmount(stake)
                .stakePercentage(stakePct)
                .rawStake(rawStake)
                .maxStakeAllowed(maxStake)
                .strategyCode(strategyCode)
                .fallbackApplied(fallback)
                .clamped(clamped)
                .kelly(kelly)
                .risk(risk)
                .warnings(warnings)
                .build();
    }

    /**
     * Linear map of confidence [floor, ceiling] to stake [min, max] %. Zero below the floor.
     */
    double confidenceScaledPercentage(double confidencePct) {
        SmartBetProperties.Staking cfg = properties.getStaking();
        if (confidencePct < cfg.getConfidenceFloorPct()) {
            return 0.0;
        }
        double span = cfg.getConfidenceCeilingPct() - cfg.getConfidenceFloorPct();
        double normalized = Math.min((confidencePct - cfg.getConfidenceFloorPct()) / span, 1.0);
        return cfg.getMinConfidenceStakePct()
                + normalized * (cfg.getMaxConfidenceStakePct() - cfg.getMinConfidenceStakePct());
    }

    private StakeSizing zero(String strategyCode, BigDecimal maxStake, KellyResult kelly, String reason) {
        return StakeSizing.builder()
                .stakeAmount(BigDecimal.ZERO.setScale(2))
                .stakePercentage(0.0)
                .rawStake(BigDecimal.ZERO.setScale(2))
                .maxStakeAllowed(maxStake)
                .strategyCode(strategyCode)
                .kelly(kelly)
                .risk(RiskAssessment.none(reason))
                .warning(reason)
                .build();
    }

    private static BigDecimal percentOf(BigDecimal bankroll, double pct) {
        return bankroll.multiply(BigDecimal.valueOf(pct)).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal fractionOf(BigDecimal bankroll, double fraction) {
        return bankroll.multiply(BigDecimal.valueOf(fraction)).setScale(2, RoundingMode.HALF_UP);
    }
}
