package com.mouse.smartbet.entity;

import com.mouse.smartbet.enums.RiskProfile;
import com.mouse.smartbet.enums.StakingStrategy;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(name = "bankroll_account",
        indexes = {
                @Index(name = "idx_bankroll_owner", columnList = "ownerId", unique = true),
                @Index(name = "idx_bankroll_last_updated", columnList = "lastUpdated")
        })
public class BankrollAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 128)
    private String ownerId;

    @Column(nullable = false, length = 3)
    @Builder.Default
    private String currency = "USD";

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal initialBankroll;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal currentBankroll;

    // Staking configuration

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private StakingStrategy strategy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private RiskProfile riskProfile;

    @Column(nullable = false)
    private Double maxStakePercentage;

    private Double kellyFraction;

    @Column(precision = 19, scale = 2)
    private BigDecimal fixedStakeAmount;

    private Double fixedStakePercentage;

    // Loss limits; a null limit is not enforced

    @Column(precision = 19, scale = 2)
    private BigDecimal dailyLossLimit;

    @Column(precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal dailyLossAmount = BigDecimal.ZERO.setScale(2);

    @Column(nullable = false)
    private Instant dailyWindowStart;

    @Column(precision = 19, scale = 2)
    private BigDecimal weeklyLossLimit;

    @Column(precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal weeklyLossAmount = BigDecimal.ZERO.setScale(2);

    @Column(nullable = false)
    private Instant weeklyWindowStart;

    // Statistics, updated on settlement

    @Builder.Default
    private Integer totalBetsPlaced = 0;

    @Builder.Default
    private Integer totalBetsWon = 0;

    @Builder.Default
    private Integer totalBetsLost = 0;

    @Column(precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal totalWagered = BigDecimal.ZERO.setScale(2);

    @Column(precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal totalProfitLoss = BigDecimal.ZERO.setScale(2);

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant lastUpdated;

    @Version
    private Integer version;

    /**
     * Check if the account can cover the amount
     */
    public boolean hasSufficientBankroll(BigDecimal amount) {
        return currentBankroll.compareTo(amount) >= 0;
    }

    /**
     * Profit/loss as a percentage of settled stakes, zero before the first settlement
     */
    public BigDecimal getRoiPercentage() {
        if (totalWagered == null || totalWagered.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return totalProfitLoss.multiply(BigDecimal.valueOf(100))
                .divide(totalWagered, 2, RoundingMode.HALF_UP);
    }

    public BigDecimal getWinRatePercentage() {
        int decided = totalBetsWon + totalBetsLost;
        if (decided == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(totalBetsWon * 100L)
                .divide(BigDecimal.valueOf(decided), 2, RoundingMode.HALF_UP);
    }
}
