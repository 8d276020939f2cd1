package com.leverageloop.engine;

import com.leverageloop.domain.enums.MarketSentiment;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunable sizing and execution parameters for leverage loops.
 *
 * <p>Properties prefix: {@code leverage.loop.*} and {@code leverage.ai.*}. The hard
 * caps in {@link LeverageSizingCalculator} apply on top of these values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoopSettings {

    private BigDecimal maxLeverageRatio;
    private int maxIterations;
    private boolean recursiveEnabled;
    private boolean swapEnabled;

    /** Capital below this fraction of portfolio value gets a single iteration. */
    private BigDecimal tinyPositionFraction;

    /** Capital below this fraction of portfolio value gets at most two iterations. */
    private BigDecimal mediumPositionFraction;

    private String defaultProtocol;
    private int slippageBps;

    private boolean aiSizingEnabled;
    private BigDecimal bullishMultiplier;
    private BigDecimal neutralMultiplier;
    private BigDecimal bearishMultiplier;

    public BigDecimal multiplierFor(MarketSentiment sentiment) {
        if (!aiSizingEnabled || sentiment == null) {
            return BigDecimal.ONE;
        }
        switch (sentiment) {
            case BULLISH:
                return bullishMultiplier;
            case BEARISH:
                return bearishMultiplier;
            case NEUTRAL:
                return neutralMultiplier;
            default:
                throw new IllegalArgumentException("Unknown sentiment " + sentiment);
        }
    }
}
