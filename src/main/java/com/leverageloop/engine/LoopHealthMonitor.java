package com.leverageloop.engine;

import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.LeveragePosition;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a loop's collateral ratio to a health score in [0, 1].
 *
 * <p>The last position's ratio reflects the whole loop because collateral and debt are
 * cumulative. Ratio 2.0 or more scores 1.0, below the 1.5 liquidation threshold scores
 * 0.0, and the band in between is linear.
 */
@Component
public class LoopHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(LoopHealthMonitor.class);

    public static final BigDecimal LIQUIDATION_THRESHOLD = new BigDecimal("1.5");
    public static final BigDecimal HEALTHY_RATIO = new BigDecimal("2.0");

    static final BigDecimal ERROR_SCORE = new BigDecimal("0.5");
    private static final BigDecimal BAND_WIDTH = HEALTHY_RATIO.subtract(LIQUIDATION_THRESHOLD);

    /**
     * Computes the loop's health and writes it onto the loop. Never throws.
     */
    public BigDecimal monitorLoopHealth(LeverageLoop loop) {
        try {
            LeveragePosition last = loop.getLastPosition();
            BigDecimal score = last == null ? BigDecimal.ONE : scoreForRatio(last.getCurrentCollateralRatio());
            loop.setHealthScore(score);
            return score;
        } catch (Exception e) {
            log.error("Failed to compute health for loop {}", loop != null ? loop.getLoopId() : null, e);
            return ERROR_SCORE;
        }
    }

    public static BigDecimal scoreForRatio(BigDecimal ratio) {
        if (ratio.compareTo(HEALTHY_RATIO) >= 0) {
            return BigDecimal.ONE;
        }
        if (ratio.compareTo(LIQUIDATION_THRESHOLD) < 0) {
            return BigDecimal.ZERO;
        }
        return ratio.subtract(LIQUIDATION_THRESHOLD).divide(BAND_WIDTH, 6, RoundingMode.HALF_UP);
    }
}
