package com.leverageloop.entity;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.PositionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the leverage_positions table. One row per loop iteration.
 */
@Entity
@Table(name = "leverage_positions", indexes = @Index(name = "idx_positions_loop", columnList = "loop_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeveragePositionEntity {

    @Id
    @Column(name = "position_id", length = 80)
    private String positionId;

    @Column(name = "loop_id", length = 64)
    private String loopId;

    private int iteration;

    @Enumerated(EnumType.STRING)
    @Column(name = "collateral_token", columnDefinition = "varchar(10)")
    private CollateralToken collateralToken;

    /** Cumulative. */
    @Column(name = "collateral_amount_usd", precision = 24, scale = 8)
    private BigDecimal collateralAmountUsd;

    /** Incremental. */
    @Column(name = "borrowed_amount_usd", precision = 24, scale = 8)
    private BigDecimal borrowedAmountUsd;

    @Column(name = "lending_protocol", length = 50)
    private String lendingProtocol;

    @Column(name = "borrowing_protocol", length = 50)
    private String borrowingProtocol;

    @Column(name = "liquidation_threshold", precision = 10, scale = 6)
    private BigDecimal liquidationThreshold;

    @Column(name = "current_collateral_ratio", precision = 18, scale = 6)
    private BigDecimal currentCollateralRatio;

    @Column(name = "health_score", precision = 10, scale = 6)
    private BigDecimal healthScore;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private PositionStatus status;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
