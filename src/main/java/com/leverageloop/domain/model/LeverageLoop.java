package com.leverageloop.domain.model;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.LoopStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Aggregate for one recursive leverage strategy instance.
 *
 * <p>Invariants maintained by the engine:
 * <ul>
 *   <li>{@code iterations == positions.size()} and {@code iterations <= maxIterations}</li>
 *   <li>{@code totalExposureUsd} equals the sum of the positions' incremental borrows</li>
 *   <li>{@code currentLeverageRatio == totalExposureUsd / initialCapitalUsd}</li>
 *   <li>positions are ordered by iteration, starting at 1 with no gaps</li>
 * </ul>
 */
@Data
@Builder
public class LeverageLoop {

    private String loopId;
    private BigDecimal initialCapitalUsd;
    private CollateralToken collateralToken;

    /** Number of positions created so far. */
    private int iterations;

    /** Iteration ceiling from sizing; reaching it marks the loop COMPLETED. */
    private int maxIterations;

    private BigDecimal currentLeverageRatio;
    private BigDecimal totalExposureUsd;

    /** Amount placed by the consolidated lend. Zero when the lend failed or never ran. */
    private BigDecimal lentAmountUsd;

    /** Set once an unwind's consolidated withdrawal has succeeded. */
    private boolean fundsWithdrawn;

    private String borrowingProtocol;
    private String lendingProtocol;

    @Builder.Default
    private List<LeveragePosition> positions = new ArrayList<>();

    private LoopStatus status;
    private BigDecimal healthScore;
    private LocalDateTime createdAt;
    private LocalDateTime closedAt;

    public LeveragePosition getLastPosition() {
        return positions.isEmpty() ? null : positions.get(positions.size() - 1);
    }
}
