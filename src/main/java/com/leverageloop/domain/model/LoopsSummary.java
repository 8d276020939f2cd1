package com.leverageloop.domain.model;

import com.leverageloop.domain.enums.LoopStatus;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Aggregate view over all active loops.
 */
@Data
@Builder
public class LoopsSummary {

    private int activeLoops;
    private BigDecimal totalExposureUsd;
    private int totalPositions;

    /** Mean leverage ratio over active loops; zero when there are none. */
    private BigDecimal averageLeverage;

    private List<LoopSummary> loops;

    @Data
    @Builder
    public static class LoopSummary {
        private String loopId;
        private int iterations;
        private BigDecimal leverageRatio;
        private BigDecimal exposureUsd;
        private BigDecimal healthScore;
        private LoopStatus status;
    }
}
