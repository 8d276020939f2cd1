package com.leverageloop.engine;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.MarketSentiment;
import com.leverageloop.domain.model.LeverageSizing;
import com.leverageloop.domain.model.PortfolioSnapshot;
import com.leverageloop.safety.PortfolioSnapshotProvider;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chooses the leverage ratio and iteration count for a new loop.
 *
 * <p>The configured base limits are scaled by the sentiment multiplier, then hard-capped
 * at 3.0x and 3 iterations. Small deployments relative to the portfolio get fewer
 * iterations: below the tiny fraction one, below the medium fraction at most two.
 * Never throws; any failure yields {@link LeverageSizing#fallback()}.
 */
@Component
public class LeverageSizingCalculator {

    private static final Logger log = LoggerFactory.getLogger(LeverageSizingCalculator.class);

    static final BigDecimal HARD_MAX_LEVERAGE = new BigDecimal("3.0");
    static final int HARD_MAX_ITERATIONS = 3;

    private final LoopSettings loopSettings;
    private final PortfolioSnapshotProvider portfolioSnapshotProvider;

    public LeverageSizingCalculator(LoopSettings loopSettings, PortfolioSnapshotProvider portfolioSnapshotProvider) {
        this.loopSettings = loopSettings;
        this.portfolioSnapshotProvider = portfolioSnapshotProvider;
    }

    public LeverageSizing calculateSafeLeverage(
            Map<CollateralToken, BigDecimal> availableCapital, MarketSentiment sentiment) {
        try {
            BigDecimal totalCapital = availableCapital.values().stream()
                    .filter(Objects::nonNull)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);

            BigDecimal multiplier = loopSettings.multiplierFor(sentiment);
            BigDecimal leverage = loopSettings.getMaxLeverageRatio().multiply(multiplier);
            int iterations = BigDecimal.valueOf(loopSettings.getMaxIterations())
                    .multiply(multiplier)
                    .intValue();

            leverage = leverage.min(HARD_MAX_LEVERAGE);
            iterations = Math.max(1, Math.min(iterations, HARD_MAX_ITERATIONS));

            BigDecimal portfolioValue = portfolioSnapshotProvider
                    .currentSnapshot()
                    .map(PortfolioSnapshot::getTotalValueUsd)
                    .filter(value -> value.signum() > 0)
                    .orElse(totalCapital);

            if (totalCapital.compareTo(portfolioValue.multiply(loopSettings.getTinyPositionFraction())) < 0) {
                iterations = 1;
            } else if (totalCapital.compareTo(portfolioValue.multiply(loopSettings.getMediumPositionFraction())) < 0) {
                iterations = Math.min(iterations, 2);
            }

            log.info(
                    "Sizing for {} USD ({} sentiment, portfolio {}): leverage {}x, {} iterations",
                    totalCapital,
                    sentiment,
                    portfolioValue,
                    leverage,
                    iterations);
            return LeverageSizing.of(leverage, iterations);

        } catch (Exception e) {
            log.error("Leverage sizing failed, using fallback", e);
            return LeverageSizing.fallback();
        }
    }
}
