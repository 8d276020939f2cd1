package com.leverageloop.domain.model;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * One borrow step of a leverage loop.
 *
 * <p>Collateral is cumulative (total collateral of the loop after this iteration);
 * the borrowed amount is incremental (debt added by this iteration alone). Summing
 * {@code borrowedAmountUsd} over a loop's positions gives its total exposure.
 */
@Data
@Builder
public class LeveragePosition {

    /** {@code <loopId>_iter_<iteration>}. */
    private String positionId;

    private String loopId;

    /** 1-based, unique within the loop. */
    private int iteration;

    private CollateralToken collateralToken;

    /** Cumulative collateral up to and including this iteration. */
    private BigDecimal collateralAmountUsd;

    /** Debt added by this iteration only. */
    private BigDecimal borrowedAmountUsd;

    private String lendingProtocol;
    private String borrowingProtocol;

    private BigDecimal liquidationThreshold;

    /** Cumulative collateral / cumulative debt at creation time. */
    private BigDecimal currentCollateralRatio;

    private BigDecimal healthScore;
    private PositionStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isActive() {
        return status == PositionStatus.ACTIVE;
    }
}
