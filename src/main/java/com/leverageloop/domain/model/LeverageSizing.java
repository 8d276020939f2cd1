package com.leverageloop.domain.model;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.ToString;

/**
 * Safe leverage ratio and iteration count chosen for a new loop.
 *
 * <p>{@link #fallback()} is the conservative sizing used whenever the calculation
 * itself fails.
 */
@Getter
@ToString
public class LeverageSizing {

    private static final BigDecimal FALLBACK_LEVERAGE = new BigDecimal("1.5");

    private final BigDecimal leverageRatio;
    private final int iterationCount;

    private LeverageSizing(BigDecimal leverageRatio, int iterationCount) {
        this.leverageRatio = leverageRatio;
        this.iterationCount = iterationCount;
    }

    public static LeverageSizing of(BigDecimal leverageRatio, int iterationCount) {
        return new LeverageSizing(leverageRatio, iterationCount);
    }

    public static LeverageSizing fallback() {
        return new LeverageSizing(FALLBACK_LEVERAGE, 1);
    }
}
