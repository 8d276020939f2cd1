package com.leverageloop.config;

import com.leverageloop.safety.SafetyLimits;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link SafetyLimits} bean. Properties prefix: {@code leverage.safety.*}
 */
@Configuration
public class SafetyConfig {

    @Bean
    public SafetyLimits safetyLimits(
            @Value("${leverage.safety.usdc-minimum-percent:0.20}") BigDecimal usdcMinimumPercent,
            @Value("${leverage.safety.usdc-emergency-percent:0.15}") BigDecimal usdcEmergencyPercent,
            @Value("${leverage.safety.sol-maximum-percent:0.20}") BigDecimal solMaximumPercent,
            @Value("${leverage.safety.emergency-usdc-reserve-percent:0.10}") BigDecimal emergencyUsdcReservePercent,
            @Value("${leverage.safety.max-total-allocation-percent:0.80}") BigDecimal maxTotalAllocationPercent,
            @Value("${leverage.safety.sol-fee-reserve-percent:0.01}") BigDecimal solFeeReservePercent) {
        return SafetyLimits.builder()
                .usdcMinimumPercent(usdcMinimumPercent)
                .usdcEmergencyPercent(usdcEmergencyPercent)
                .solMaximumPercent(solMaximumPercent)
                .emergencyUsdcReservePercent(emergencyUsdcReservePercent)
                .maxTotalAllocationPercent(maxTotalAllocationPercent)
                .solFeeReservePercent(solFeeReservePercent)
                .build();
    }
}
