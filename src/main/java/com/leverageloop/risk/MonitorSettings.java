package com.leverageloop.risk;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Thresholds used by {@link LoopRiskMonitor}. Properties prefix: {@code leverage.monitor.*}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitorSettings {

    /** When false the monitor only reports; it never commands an unwind. */
    private boolean autoUnwindEnabled;

    /** Health below this triggers an emergency unwind. */
    private BigDecimal unwindHealthThreshold;

    /** Health below this publishes a warning. */
    private BigDecimal warningHealthThreshold;

    /** Deployable capital below this unwinds every loop. */
    private BigDecimal minDeployableCapitalUsd;
}
