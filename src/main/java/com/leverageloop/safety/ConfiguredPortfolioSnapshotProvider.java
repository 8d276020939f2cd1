package com.leverageloop.safety;

import com.leverageloop.domain.model.PortfolioSnapshot;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper-trading portfolio: a fixed snapshot built from configuration.
 * Returns empty when {@code leverage.portfolio.total-value-usd} is zero.
 */
@Component
@ConditionalOnProperty(name = "leverage.paper-trading", havingValue = "true", matchIfMissing = true)
public class ConfiguredPortfolioSnapshotProvider implements PortfolioSnapshotProvider {

    private final BigDecimal totalValueUsd;
    private final BigDecimal usdcBalanceUsd;
    private final BigDecimal solBalanceUsd;
    private final BigDecimal currentAllocationPct;
    private final BigDecimal availableForDefiUsd;

    public ConfiguredPortfolioSnapshotProvider(
            @Value("${leverage.portfolio.total-value-usd:100000}") BigDecimal totalValueUsd,
            @Value("${leverage.portfolio.usdc-balance-usd:50000}") BigDecimal usdcBalanceUsd,
            @Value("${leverage.portfolio.sol-balance-usd:15000}") BigDecimal solBalanceUsd,
            @Value("${leverage.portfolio.current-allocation-pct:0.20}") BigDecimal currentAllocationPct,
            @Value("${leverage.portfolio.available-for-defi-usd:20000}") BigDecimal availableForDefiUsd) {
        this.totalValueUsd = totalValueUsd;
        this.usdcBalanceUsd = usdcBalanceUsd;
        this.solBalanceUsd = solBalanceUsd;
        this.currentAllocationPct = currentAllocationPct;
        this.availableForDefiUsd = availableForDefiUsd;
    }

    @Override
    public Optional<PortfolioSnapshot> currentSnapshot() {
        if (totalValueUsd.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(PortfolioSnapshot.builder()
                .totalValueUsd(totalValueUsd)
                .usdcBalanceUsd(usdcBalanceUsd)
                .solBalanceUsd(solBalanceUsd)
                .currentAllocationPct(currentAllocationPct)
                .availableForDefiUsd(availableForDefiUsd)
                .takenAt(LocalDateTime.now())
                .build());
    }
}
