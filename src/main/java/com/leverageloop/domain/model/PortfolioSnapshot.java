package com.leverageloop.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time view of the wallet used by the safety gate, the sizing calculator
 * and the risk monitor. Percentages are fractions of {@code totalValueUsd}.
 */
@Data
@Builder
public class PortfolioSnapshot {

    private BigDecimal totalValueUsd;
    private BigDecimal usdcBalanceUsd;
    private BigDecimal solBalanceUsd;

    /** Fraction of the portfolio already deployed, 0..1. */
    private BigDecimal currentAllocationPct;

    /** Capital the DeFi component may still deploy. */
    private BigDecimal availableForDefiUsd;

    private LocalDateTime takenAt;

    public BigDecimal usdcShare() {
        return share(usdcBalanceUsd);
    }

    public BigDecimal solShare() {
        return share(solBalanceUsd);
    }

    private BigDecimal share(BigDecimal balance) {
        if (totalValueUsd == null || totalValueUsd.signum() <= 0 || balance == null) {
            return BigDecimal.ZERO;
        }
        return balance.divide(totalValueUsd, 6, RoundingMode.HALF_UP);
    }
}
