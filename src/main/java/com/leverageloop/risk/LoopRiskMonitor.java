package com.leverageloop.risk;

import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.PortfolioSnapshot;
import com.leverageloop.engine.LeverageLoopEngine;
import com.leverageloop.event.RiskEvent;
import com.leverageloop.event.RiskEventType;
import com.leverageloop.event.RiskLevel;
import com.leverageloop.safety.PortfolioSnapshotProvider;
import com.leverageloop.safety.SafetyLimits;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically checks every active loop and decides whether to unwind it.
 *
 * <p>Per tick:
 * <ul>
 *   <li><b>Capital reserve:</b> deployable capital below the minimum publishes a CRITICAL
 *       event and emergency-unwinds every loop.</li>
 *   <li><b>Unwind:</b> health below the unwind threshold triggers an emergency unwind;
 *       USDC share below the emergency floor triggers a graceful one.</li>
 *   <li><b>Warning:</b> health below the warning threshold publishes a WARNING event once
 *       per loop until its health recovers.</li>
 * </ul>
 *
 * <p>With auto-unwind disabled the monitor only reports. A failure on one loop is logged
 * and the others are still checked.
 */
@Service
public class LoopRiskMonitor {

    private static final Logger log = LoggerFactory.getLogger(LoopRiskMonitor.class);

    private final LeverageLoopEngine leverageLoopEngine;
    private final PortfolioSnapshotProvider portfolioSnapshotProvider;
    private final MonitorSettings monitorSettings;
    private final SafetyLimits safetyLimits;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final Set<String> warnedLoopIds = ConcurrentHashMap.newKeySet();

    public LoopRiskMonitor(
            LeverageLoopEngine leverageLoopEngine,
            PortfolioSnapshotProvider portfolioSnapshotProvider,
            MonitorSettings monitorSettings,
            SafetyLimits safetyLimits,
            ApplicationEventPublisher applicationEventPublisher) {
        this.leverageLoopEngine = leverageLoopEngine;
        this.portfolioSnapshotProvider = portfolioSnapshotProvider;
        this.monitorSettings = monitorSettings;
        this.safetyLimits = safetyLimits;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Scheduled(
            fixedRateString = "${leverage.monitor.interval-ms:60000}",
            initialDelayString = "${leverage.monitor.initial-delay-ms:60000}")
    public void checkLoops() {
        checkLoops(portfolioSnapshotProvider.currentSnapshot().orElse(null));
    }

    /**
     * Checks active loops against the given snapshot. Public for testability; a null
     * snapshot skips the portfolio-level checks.
     */
    public void checkLoops(PortfolioSnapshot snapshot) {
        List<LeverageLoop> loops = leverageLoopEngine.getActiveLoops();
        if (loops.isEmpty()) {
            warnedLoopIds.clear();
            return;
        }

        if (snapshot != null && isCapitalReserveBreached(snapshot)) {
            handleCapitalReserveBreach(snapshot, loops.size());
            return;
        }

        boolean usdcEmergency = snapshot != null
                && snapshot.usdcShare().compareTo(safetyLimits.getUsdcEmergencyPercent()) < 0;

        for (LeverageLoop loop : loops) {
            try {
                checkLoop(loop, usdcEmergency);
            } catch (Exception e) {
                log.warn("Risk check failed for loop {}", loop.getLoopId(), e);
            }
        }
    }

    private void checkLoop(LeverageLoop loop, boolean usdcEmergency) {
        BigDecimal health = leverageLoopEngine.monitorLoopHealth(loop);
        boolean healthCritical = health.compareTo(monitorSettings.getUnwindHealthThreshold()) < 0;

        if (healthCritical || usdcEmergency) {
            String reason = healthCritical
                    ? "health " + health + " below " + monitorSettings.getUnwindHealthThreshold()
                    : "USDC share below emergency floor";
            triggerUnwind(loop, health, healthCritical, reason);
            return;
        }

        if (health.compareTo(monitorSettings.getWarningHealthThreshold()) < 0) {
            if (warnedLoopIds.add(loop.getLoopId())) {
                log.warn("Loop {} health degraded to {}", loop.getLoopId(), health);
                applicationEventPublisher.publishEvent(new RiskEvent(
                        this,
                        RiskEventType.LOOP_HEALTH_DEGRADED,
                        RiskLevel.WARNING,
                        "Loop " + loop.getLoopId() + " health at " + health,
                        Map.of(
                                "loopId",
                                loop.getLoopId(),
                                "healthScore",
                                health,
                                "threshold",
                                monitorSettings.getWarningHealthThreshold())));
            }
        } else {
            warnedLoopIds.remove(loop.getLoopId());
        }
    }

    private void triggerUnwind(LeverageLoop loop, BigDecimal health, boolean emergency, String reason) {
        if (!monitorSettings.isAutoUnwindEnabled()) {
            log.warn("Loop {} needs unwind ({}) but auto-unwind is disabled", loop.getLoopId(), reason);
            return;
        }

        log.error("Unwinding loop {}: {}", loop.getLoopId(), reason);
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.UNWIND_TRIGGERED,
                RiskLevel.CRITICAL,
                "Unwinding loop " + loop.getLoopId() + ": " + reason,
                Map.of("loopId", loop.getLoopId(), "healthScore", health, "emergency", emergency)));

        if (leverageLoopEngine.unwindLoop(loop, emergency)) {
            warnedLoopIds.remove(loop.getLoopId());
        } else {
            log.error("Unwind of loop {} failed, will retry next check", loop.getLoopId());
        }
    }

    private boolean isCapitalReserveBreached(PortfolioSnapshot snapshot) {
        BigDecimal available = snapshot.getAvailableForDefiUsd();
        return available != null && available.compareTo(monitorSettings.getMinDeployableCapitalUsd()) < 0;
    }

    private void handleCapitalReserveBreach(PortfolioSnapshot snapshot, int activeLoops) {
        log.error(
                "CRITICAL: deployable capital {} USD below {} USD with {} active loops",
                snapshot.getAvailableForDefiUsd(),
                monitorSettings.getMinDeployableCapitalUsd(),
                activeLoops);
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.CAPITAL_RESERVE_BREACH,
                RiskLevel.CRITICAL,
                "Deployable capital " + snapshot.getAvailableForDefiUsd() + " USD below minimum",
                Map.of(
                        "availableForDefiUsd",
                        snapshot.getAvailableForDefiUsd(),
                        "threshold",
                        monitorSettings.getMinDeployableCapitalUsd(),
                        "activeLoops",
                        activeLoops)));

        if (monitorSettings.isAutoUnwindEnabled()) {
            int unwound = leverageLoopEngine.emergencyUnwindAllLoops();
            log.error("Capital reserve breach: {}/{} loops unwound", unwound, activeLoops);
        }
    }

    /** Clears warning deduplication so degraded loops are reported again. */
    public void resetWarnings() {
        warnedLoopIds.clear();
    }
}
