package com.leverageloop.config;

import com.leverageloop.engine.LoopSettings;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link LoopSettings} bean from application.properties.
 *
 * <p>Properties prefix: {@code leverage.loop.*}, {@code leverage.ai.*}
 */
@Configuration
public class LoopConfig {

    @Bean
    public LoopSettings loopSettings(
            @Value("${leverage.loop.max-leverage-ratio:3.0}") BigDecimal maxLeverageRatio,
            @Value("${leverage.loop.max-iterations:3}") int maxIterations,
            @Value("${leverage.loop.recursive-enabled:true}") boolean recursiveEnabled,
            @Value("${leverage.loop.swap-enabled:true}") boolean swapEnabled,
            @Value("${leverage.loop.tiny-position-fraction:0.001}") BigDecimal tinyPositionFraction,
            @Value("${leverage.loop.medium-position-fraction:0.005}") BigDecimal mediumPositionFraction,
            @Value("${leverage.loop.default-protocol:solend}") String defaultProtocol,
            @Value("${leverage.loop.slippage-bps:200}") int slippageBps,
            @Value("${leverage.ai.enabled:true}") boolean aiSizingEnabled,
            @Value("${leverage.ai.bullish-multiplier:1.2}") BigDecimal bullishMultiplier,
            @Value("${leverage.ai.neutral-multiplier:1.0}") BigDecimal neutralMultiplier,
            @Value("${leverage.ai.bearish-multiplier:0.8}") BigDecimal bearishMultiplier) {
        return LoopSettings.builder()
                .maxLeverageRatio(maxLeverageRatio)
                .maxIterations(maxIterations)
                .recursiveEnabled(recursiveEnabled)
                .swapEnabled(swapEnabled)
                .tinyPositionFraction(tinyPositionFraction)
                .mediumPositionFraction(mediumPositionFraction)
                .defaultProtocol(defaultProtocol)
                .slippageBps(slippageBps)
                .aiSizingEnabled(aiSizingEnabled)
                .bullishMultiplier(bullishMultiplier)
                .neutralMultiplier(neutralMultiplier)
                .bearishMultiplier(bearishMultiplier)
                .build();
    }
}
