package com.leverageloop.safety;

import com.leverageloop.domain.enums.SafetyRiskLevel;
import com.leverageloop.domain.model.PortfolioSnapshot;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Allocation-based safety gate run before every DeFi deployment.
 *
 * <p>Checks, in order, stopping at the first that blocks:
 * <ol>
 *   <li>a snapshot exists</li>
 *   <li>USDC share is above the emergency floor, then above the minimum</li>
 *   <li>SOL share is below its maximum</li>
 *   <li>USDC share after spending {@code amountUsd} stays above the minimum</li>
 *   <li>USDC after spending stays above the emergency reserve</li>
 *   <li>total allocation after the operation stays below the maximum</li>
 *   <li>SOL covers the fee reserve (warning only, the operation is still allowed)</li>
 * </ol>
 *
 * <p>Never throws: an unexpected error blocks the operation with DANGER.
 */
@Service
public class PortfolioSafetyGate implements SafetyGate {

    private static final Logger log = LoggerFactory.getLogger(PortfolioSafetyGate.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final SafetyLimits safetyLimits;

    public PortfolioSafetyGate(SafetyLimits safetyLimits) {
        this.safetyLimits = safetyLimits;
    }

    @Override
    public SafetyCheckResult canExecute(BigDecimal amountUsd, String operationKind, PortfolioSnapshot snapshot) {
        try {
            if (snapshot == null) {
                return SafetyCheckResult.blocked(
                        "No portfolio snapshot available", SafetyRiskLevel.DANGER, "Wait for portfolio data");
            }

            BigDecimal totalValue = snapshot.getTotalValueUsd();
            BigDecimal usdcBalance = orZero(snapshot.getUsdcBalanceUsd());
            BigDecimal solBalance = orZero(snapshot.getSolBalanceUsd());
            BigDecimal usdcPct = snapshot.usdcShare();
            BigDecimal solPct = snapshot.solShare();

            if (usdcPct.compareTo(safetyLimits.getUsdcEmergencyPercent()) < 0) {
                log.error("EMERGENCY: USDC at {}% of portfolio, blocking {}", pct(usdcPct), operationKind);
                return SafetyCheckResult.blocked(
                        "EMERGENCY: USDC at " + pct(usdcPct) + "%",
                        SafetyRiskLevel.DANGER,
                        "EMERGENCY STOP - All DeFi operations halted");
            }

            if (usdcPct.compareTo(safetyLimits.getUsdcMinimumPercent()) < 0) {
                log.warn("BLOCKED: USDC reserves {}% below minimum", pct(usdcPct));
                return SafetyCheckResult.blocked(
                        "USDC reserves " + pct(usdcPct) + "% below minimum "
                                + pct(safetyLimits.getUsdcMinimumPercent()) + "%",
                        SafetyRiskLevel.DANGER,
                        "Wait for USDC reserves to be replenished");
            }

            if (solPct.compareTo(safetyLimits.getSolMaximumPercent()) > 0) {
                log.warn("BLOCKED: SOL allocation {}% exceeds maximum", pct(solPct));
                return SafetyCheckResult.blocked(
                        "SOL allocation " + pct(solPct) + "% exceeds maximum "
                                + pct(safetyLimits.getSolMaximumPercent()) + "%",
                        SafetyRiskLevel.WARNING,
                        "Convert excess SOL to USDC");
            }

            BigDecimal usdcAfter = usdcBalance.subtract(amountUsd);
            BigDecimal usdcPctAfter = fraction(usdcAfter, totalValue);
            if (usdcPctAfter.compareTo(safetyLimits.getUsdcMinimumPercent()) < 0) {
                BigDecimal maxAmount = usdcBalance.subtract(totalValue.multiply(safetyLimits.getUsdcMinimumPercent()));
                log.warn("BLOCKED: {} of {} USD would drop USDC to {}%", operationKind, amountUsd, pct(usdcPctAfter));
                return SafetyCheckResult.blocked(
                        "Operation would drop USDC to " + pct(usdcPctAfter) + "% (minimum "
                                + pct(safetyLimits.getUsdcMinimumPercent()) + "%)",
                        SafetyRiskLevel.DANGER,
                        "Reduce amount to $" + maxAmount.setScale(2, RoundingMode.HALF_UP));
            }

            BigDecimal usdcReserve = totalValue.multiply(safetyLimits.getEmergencyUsdcReservePercent());
            if (usdcAfter.compareTo(usdcReserve) < 0) {
                log.warn("BLOCKED: {} would breach emergency reserve {}", operationKind, usdcReserve);
                return SafetyCheckResult.blocked(
                        "Would breach emergency USDC reserve of $" + usdcReserve.setScale(2, RoundingMode.HALF_UP),
                        SafetyRiskLevel.DANGER,
                        "Emergency reserves must be maintained");
            }

            BigDecimal allocationAfter =
                    orZero(snapshot.getCurrentAllocationPct()).add(fraction(amountUsd, totalValue));
            if (allocationAfter.compareTo(safetyLimits.getMaxTotalAllocationPercent()) > 0) {
                log.warn("BLOCKED: allocation after {} would be {}%", operationKind, pct(allocationAfter));
                return SafetyCheckResult.blocked(
                        "Would exceed max total allocation " + pct(safetyLimits.getMaxTotalAllocationPercent()) + "%",
                        SafetyRiskLevel.WARNING,
                        "Reduce position size or close some positions");
            }

            BigDecimal solReserve = totalValue.multiply(safetyLimits.getSolFeeReservePercent());
            if (solBalance.compareTo(solReserve) < 0) {
                log.warn("SOL balance {} below fee reserve {}", solBalance, solReserve);
                return SafetyCheckResult.passedWithWarning(
                        "SOL below ideal fee reserve", "Monitor SOL balance for transaction fees");
            }

            log.info("Safety checks passed for {}: USDC {}%, SOL {}%", operationKind, pct(usdcPct), pct(solPct));
            return SafetyCheckResult.passed();

        } catch (Exception e) {
            log.error("Error in safety validation for {}", operationKind, e);
            return SafetyCheckResult.blocked(
                    "Validation error: " + e.getMessage(), SafetyRiskLevel.DANGER, "Manual review required");
        }
    }

    private BigDecimal fraction(BigDecimal amount, BigDecimal totalValue) {
        if (totalValue == null || totalValue.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return amount.divide(totalValue, 6, RoundingMode.HALF_UP);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static String pct(BigDecimal fraction) {
        return fraction.multiply(HUNDRED).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
