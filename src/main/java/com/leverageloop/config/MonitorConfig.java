package com.leverageloop.config;

import com.leverageloop.risk.MonitorSettings;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link MonitorSettings} bean. Properties prefix: {@code leverage.monitor.*}
 *
 * <p>The monitor interval itself ({@code leverage.monitor.interval-ms}) is read directly
 * by the {@code @Scheduled} annotation on the monitor.
 */
@Configuration
public class MonitorConfig {

    @Bean
    public MonitorSettings monitorSettings(
            @Value("${leverage.monitor.auto-unwind-enabled:true}") boolean autoUnwindEnabled,
            @Value("${leverage.monitor.unwind-health-threshold:0.3}") BigDecimal unwindHealthThreshold,
            @Value("${leverage.monitor.warning-health-threshold:0.7}") BigDecimal warningHealthThreshold,
            @Value("${leverage.monitor.min-deployable-capital-usd:100}") BigDecimal minDeployableCapitalUsd) {
        return MonitorSettings.builder()
                .autoUnwindEnabled(autoUnwindEnabled)
                .unwindHealthThreshold(unwindHealthThreshold)
                .warningHealthThreshold(warningHealthThreshold)
                .minDeployableCapitalUsd(minDeployableCapitalUsd)
                .build();
    }
}
