package com.leverageloop.recovery;

import com.leverageloop.domain.enums.LoopStatus;
import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.LeveragePosition;
import com.leverageloop.engine.ActiveLoopRegistry;
import com.leverageloop.engine.LeverageLoopEngine;
import com.leverageloop.engine.LoopHealthMonitor;
import com.leverageloop.event.LoopEvent;
import com.leverageloop.event.LoopEventType;
import com.leverageloop.store.PositionStore;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the in-memory active loop map from the store after a restart.
 *
 * <p>Steps:
 * <ol>
 *   <li>Load loops with a live status (ACTIVE, COMPLETED, PARTIAL)</li>
 *   <li>Load active positions and attach them to their loops in iteration order</li>
 *   <li>Recompute iterations, exposure, leverage and health, then register each loop</li>
 * </ol>
 *
 * <p>A loop still stored as ACTIVE was interrupted mid-deploy. It is settled as COMPLETED
 * when all planned iterations were recorded, otherwise PARTIAL, and the status is saved.
 *
 * <p>No protocol calls are made. A loop already present in the active map is skipped,
 * so running recovery twice is harmless. A store failure is logged and startup continues
 * with whatever was recovered.
 */
@Service
public class LoopRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(LoopRecoveryService.class);

    private final PositionStore positionStore;
    private final ActiveLoopRegistry activeLoopRegistry;
    private final LoopHealthMonitor loopHealthMonitor;
    private final ApplicationEventPublisher applicationEventPublisher;

    public LoopRecoveryService(
            PositionStore positionStore,
            ActiveLoopRegistry activeLoopRegistry,
            LoopHealthMonitor loopHealthMonitor,
            ApplicationEventPublisher applicationEventPublisher) {
        this.positionStore = positionStore;
        this.activeLoopRegistry = activeLoopRegistry;
        this.loopHealthMonitor = loopHealthMonitor;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Runs at Order(10), ahead of the first risk monitor tick.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        runRecovery();
    }

    public RecoveryResult runRecovery() {
        log.info("Recovering active leverage loops...");

        RecoveryResult recoveryResult =
                RecoveryResult.builder().startedAt(System.currentTimeMillis()).build();

        try {
            List<LeverageLoop> loops = loadLoops();
            Map<String, List<LeveragePosition>> positionsByLoop = loadPositions();

            for (LeverageLoop loop : loops) {
                if (activeLoopRegistry.isActive(loop.getLoopId())) {
                    log.debug("Loop {} already active, skipping", loop.getLoopId());
                    recoveryResult.setLoopsSkipped(recoveryResult.getLoopsSkipped() + 1);
                    continue;
                }
                List<LeveragePosition> positions = positionsByLoop.getOrDefault(loop.getLoopId(), new ArrayList<>());
                rebuildLoop(loop, positions);
                if (activeLoopRegistry.register(loop)) {
                    recoveryResult.setLoopsRecovered(recoveryResult.getLoopsRecovered() + 1);
                    recoveryResult.setPositionsRecovered(recoveryResult.getPositionsRecovered() + positions.size());
                    recoveryResult.getRecoveredLoopIds().add(loop.getLoopId());
                    applicationEventPublisher.publishEvent(new LoopEvent(
                            this,
                            LoopEventType.LOOP_RECOVERED,
                            loop.getLoopId(),
                            loop.getStatus(),
                            loop.getIterations(),
                            loop.getTotalExposureUsd()));
                } else {
                    recoveryResult.setLoopsSkipped(recoveryResult.getLoopsSkipped() + 1);
                }
            }

            recoveryResult.setSuccess(true);

        } catch (Exception e) {
            recoveryResult.setSuccess(false);
            recoveryResult.setError(e.getMessage());
            log.error("Loop recovery failed, continuing startup with {} recovered", recoveryResult.getLoopsRecovered(), e);
        }

        recoveryResult.setDurationMs(System.currentTimeMillis() - recoveryResult.getStartedAt());
        log.info(
                "Loop recovery {}: {} loops, {} positions, {} skipped in {}ms",
                recoveryResult.isSuccess() ? "completed" : "failed",
                recoveryResult.getLoopsRecovered(),
                recoveryResult.getPositionsRecovered(),
                recoveryResult.getLoopsSkipped(),
                recoveryResult.getDurationMs());
        return recoveryResult;
    }

    // ========================
    // STEPS
    // ========================

    List<LeverageLoop> loadLoops() {
        List<LeverageLoop> loops = positionStore.getActiveLoops();
        log.info("Found {} live loops in store", loops.size());
        return loops;
    }

    Map<String, List<LeveragePosition>> loadPositions() {
        return positionStore.getActivePositions().stream()
                .sorted(Comparator.comparingInt(LeveragePosition::getIteration))
                .collect(Collectors.groupingBy(LeveragePosition::getLoopId, Collectors.toList()));
    }

    void rebuildLoop(LeverageLoop loop, List<LeveragePosition> positions) {
        loop.setPositions(new ArrayList<>(positions));
        loop.setIterations(positions.size());

        BigDecimal exposure = positions.stream()
                .map(LeveragePosition::getBorrowedAmountUsd)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        loop.setTotalExposureUsd(exposure);
        loop.setCurrentLeverageRatio(LeverageLoopEngine.leverageRatio(exposure, loop.getInitialCapitalUsd()));
        if (loop.getLentAmountUsd() == null) {
            loop.setLentAmountUsd(BigDecimal.ZERO);
        }
        loopHealthMonitor.monitorLoopHealth(loop);

        if (loop.getStatus() == LoopStatus.ACTIVE) {
            // deployment was cut short, settle the status from what was recorded
            loop.setStatus(loop.getIterations() == loop.getMaxIterations() ? LoopStatus.COMPLETED : LoopStatus.PARTIAL);
            positionStore.saveLoop(loop);
            log.warn(
                    "Loop {} was still deploying at shutdown, settled as {} after {} of {} iterations",
                    loop.getLoopId(),
                    loop.getStatus(),
                    loop.getIterations(),
                    loop.getMaxIterations());
        }

        log.info(
                "Recovered loop {} ({}): {} positions, exposure {} USD, leverage {}x, health {}",
                loop.getLoopId(),
                loop.getStatus(),
                positions.size(),
                exposure,
                loop.getCurrentLeverageRatio(),
                loop.getHealthScore());
    }
}
