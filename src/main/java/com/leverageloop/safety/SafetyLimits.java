package com.leverageloop.safety;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Portfolio allocation limits enforced by {@link PortfolioSafetyGate}.
 * All percentages are fractions of total portfolio value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafetyLimits {

    /** USDC share below which no DeFi operation may start. */
    private BigDecimal usdcMinimumPercent;

    /** USDC share below which the portfolio is in emergency; also drives monitor unwinds. */
    private BigDecimal usdcEmergencyPercent;

    private BigDecimal solMaximumPercent;

    /** USDC that must remain untouched after any operation. */
    private BigDecimal emergencyUsdcReservePercent;

    private BigDecimal maxTotalAllocationPercent;

    /** SOL kept for transaction fees. Falling below only warns. */
    private BigDecimal solFeeReservePercent;
}
