package com.leverageloop.safety;

import com.leverageloop.domain.model.PortfolioSnapshot;
import java.math.BigDecimal;

/**
 * Pre-trade policy check for DeFi operations. A null snapshot is always unsafe.
 */
public interface SafetyGate {

    SafetyCheckResult canExecute(BigDecimal amountUsd, String operationKind, PortfolioSnapshot snapshot);
}
