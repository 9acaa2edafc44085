package com.mouse.smartbet.entity;

import com.mouse.smartbet.enums.BetStatus;
import com.mouse.smartbet.enums.Outcome;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(
        name = "bet_transaction",
        indexes = {
                @Index(name = "idx_tx_account_status", columnList = "account_id,status"),
                @Index(name = "idx_tx_account_created", columnList = "account_id,createdAt"),
                @Index(name = "idx_tx_prediction", columnList = "predictionId")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = "account")
public class BetTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Integer version;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(
            name = "account_id",
            nullable = false,
            foreignKey = @ForeignKey(name = "fk_bettx_account")
    )
    private BankrollAccount account;

    @Column(length = 64)
    private String predictionId;

    @Column(length = 64)
    private String leagueKey;

    @Column(length = 256)
    private String matchDescription;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private Outcome selectedOutcome;

    @Column(nullable = false, precision = 10, scale = 4)
    private BigDecimal odds;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal stake;

    /** stake * odds */
    @Column(precision = 19, scale = 2)
    private BigDecimal potentialReturn;

    /** amount credited back on settlement */
    @Column(precision = 19, scale = 2)
    private BigDecimal actualReturn;

    @Column(precision = 19, scale = 2)
    private BigDecimal profitLoss;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    @Builder.Default
    private BetStatus status = BetStatus.PENDING;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal bankrollBefore;

    @Column(precision = 19, scale = 2)
    private BigDecimal bankrollAfter;

    @Column(precision = 19, scale = 2)
    private BigDecimal recommendedStake;

    @Column(length = 32)
    private String strategyUsed;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant settledAt;

    public boolean isPending() {
        return status == BetStatus.PENDING;
    }
}
