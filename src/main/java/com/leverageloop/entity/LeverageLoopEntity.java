package com.leverageloop.entity;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.LoopStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the leverage_loops table.
 * Running totals are rewritten after every iteration so that a restart can rebuild the
 * loop without replaying protocol calls.
 */
@Entity
@Table(name = "leverage_loops")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeverageLoopEntity {

    @Id
    @Column(name = "loop_id", length = 64)
    private String loopId;

    @Column(name = "initial_capital_usd", precision = 24, scale = 8)
    private BigDecimal initialCapitalUsd;

    @Enumerated(EnumType.STRING)
    @Column(name = "collateral_token", columnDefinition = "varchar(10)")
    private CollateralToken collateralToken;

    private int iterations;

    @Column(name = "max_iterations")
    private int maxIterations;

    @Column(name = "leverage_ratio", precision = 18, scale = 6)
    private BigDecimal currentLeverageRatio;

    @Column(name = "total_exposure_usd", precision = 24, scale = 8)
    private BigDecimal totalExposureUsd;

    @Column(name = "lent_amount_usd", precision = 24, scale = 8)
    private BigDecimal lentAmountUsd;

    @Column(name = "funds_withdrawn")
    private boolean fundsWithdrawn;

    @Column(name = "borrowing_protocol", length = 50)
    private String borrowingProtocol;

    @Column(name = "lending_protocol", length = 50)
    private String lendingProtocol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private LoopStatus status;

    @Column(name = "health_score", precision = 10, scale = 6)
    private BigDecimal healthScore;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;
}
