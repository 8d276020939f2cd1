package com.leverageloop.engine;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.IterationOutcome;
import com.leverageloop.domain.enums.LedgerAction;
import com.leverageloop.domain.enums.LoopStatus;
import com.leverageloop.domain.enums.MarketSentiment;
import com.leverageloop.domain.enums.PositionStatus;
import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.LeveragePosition;
import com.leverageloop.domain.model.LeverageSizing;
import com.leverageloop.domain.model.LoopsSummary;
import com.leverageloop.domain.model.PortfolioSnapshot;
import com.leverageloop.domain.model.ReservedBalance;
import com.leverageloop.event.LoopEvent;
import com.leverageloop.event.LoopEventType;
import com.leverageloop.ledger.TransactionLog;
import com.leverageloop.protocol.ProtocolGateway;
import com.leverageloop.protocol.ProtocolResult;
import com.leverageloop.safety.PortfolioSnapshotProvider;
import com.leverageloop.safety.SafetyCheckResult;
import com.leverageloop.safety.SafetyGate;
import com.leverageloop.store.PositionStore;
import com.leverageloop.swap.CollateralSwapAdapter;
import com.leverageloop.swap.SwapResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Recursive leverage engine: deploys capital as a loop of borrow/swap iterations
 * followed by one consolidated lend, and exposes the health, unwind and summary
 * operations the orchestrating agent needs.
 *
 * <p><b>Deployment sequence:</b>
 * <ol>
 *   <li>Safety gate on the initial capital. Unsafe returns null with nothing persisted.</li>
 *   <li>Sizing; the iteration count is the smaller of the safe count and the target.</li>
 *   <li>Loop record persisted as ACTIVE and marked as deploying in the registry.</li>
 *   <li>Iterations, each borrowing the whole remaining capacity under the 75% LTV
 *       ceiling, optionally swapping the borrowed value back into collateral, and
 *       persisting the position, running totals and reservation together.</li>
 *   <li>One lend of the cumulative debt, then COMPLETED or PARTIAL, the reservation
 *       rewritten and the loop registered as active.</li>
 * </ol>
 *
 * <p>A partially built loop is never rolled back: debt that was actually incurred stays
 * on record so an unwind can repay it; once a borrow succeeds its position is recorded
 * even if the swap or ledger write after it fails. Health and unwind mechanics are delegated to
 * {@link LoopHealthMonitor} and {@link LoopUnwindService}.
 */
@Service
public class LeverageLoopEngine {

    private static final Logger log = LoggerFactory.getLogger(LeverageLoopEngine.class);

    static final String OPERATION_KIND = "leverage_loop";
    static final String SWAP_VENUE = "swap";

    /** Loan-to-value ceiling applied to total collateral. */
    static final BigDecimal MAX_LTV = new BigDecimal("0.75");

    private static final int RATIO_SCALE = 6;

    private final SafetyGate safetyGate;
    private final PortfolioSnapshotProvider portfolioSnapshotProvider;
    private final LeverageSizingCalculator leverageSizingCalculator;
    private final ProtocolGateway protocolGateway;
    private final CollateralSwapAdapter collateralSwapAdapter;
    private final PositionStore positionStore;
    private final TransactionLog transactionLog;
    private final ActiveLoopRegistry activeLoopRegistry;
    private final ReservationCalculator reservationCalculator;
    private final LoopHealthMonitor loopHealthMonitor;
    private final LoopUnwindService loopUnwindService;
    private final LoopSettings loopSettings;
    private final ApplicationEventPublisher applicationEventPublisher;

    public LeverageLoopEngine(
            SafetyGate safetyGate,
            PortfolioSnapshotProvider portfolioSnapshotProvider,
            LeverageSizingCalculator leverageSizingCalculator,
            ProtocolGateway protocolGateway,
            CollateralSwapAdapter collateralSwapAdapter,
            PositionStore positionStore,
            TransactionLog transactionLog,
            ActiveLoopRegistry activeLoopRegistry,
            ReservationCalculator reservationCalculator,
            LoopHealthMonitor loopHealthMonitor,
            LoopUnwindService loopUnwindService,
            LoopSettings loopSettings,
            ApplicationEventPublisher applicationEventPublisher) {
        this.safetyGate = safetyGate;
        this.portfolioSnapshotProvider = portfolioSnapshotProvider;
        this.leverageSizingCalculator = leverageSizingCalculator;
        this.protocolGateway = protocolGateway;
        this.collateralSwapAdapter = collateralSwapAdapter;
        this.positionStore = positionStore;
        this.transactionLog = transactionLog;
        this.activeLoopRegistry = activeLoopRegistry;
        this.reservationCalculator = reservationCalculator;
        this.loopHealthMonitor = loopHealthMonitor;
        this.loopUnwindService = loopUnwindService;
        this.loopSettings = loopSettings;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // DEPLOYMENT
    // ========================

    public LeverageLoop executeLeverageLoop(
            BigDecimal initialCapitalUsd,
            CollateralToken collateralToken,
            MarketSentiment sentiment,
            int targetIterations) {
        return executeLeverageLoop(initialCapitalUsd, collateralToken, sentiment, targetIterations, null, null);
    }

    /**
     * Deploys a new leverage loop.
     *
     * @return the finalized loop, or null when the deployment was refused (invalid input,
     *     unsafe portfolio) or failed before the loop could be tracked
     */
    public LeverageLoop executeLeverageLoop(
            BigDecimal initialCapitalUsd,
            CollateralToken collateralToken,
            MarketSentiment sentiment,
            int targetIterations,
            String borrowingProtocol,
            String lendingProtocol) {
        if (initialCapitalUsd == null || initialCapitalUsd.signum() <= 0) {
            log.warn("Refusing leverage loop with non-positive capital {}", initialCapitalUsd);
            return null;
        }
        if (collateralToken == null || targetIterations < 1) {
            log.warn("Refusing leverage loop: collateral={}, targetIterations={}", collateralToken, targetIterations);
            return null;
        }

        try {
            PortfolioSnapshot snapshot =
                    portfolioSnapshotProvider.currentSnapshot().orElse(null);
            SafetyCheckResult safety = safetyGate.canExecute(initialCapitalUsd, OPERATION_KIND, snapshot);
            if (!safety.isSafe()) {
                log.warn(
                        "Leverage loop of {} USD rejected by safety gate: {} ({})",
                        initialCapitalUsd,
                        safety.getReason(),
                        safety.getRecommendedAction());
                return null;
            }

            LeverageSizing sizing =
                    leverageSizingCalculator.calculateSafeLeverage(Map.of(collateralToken, initialCapitalUsd), sentiment);
            int iterations = Math.min(sizing.getIterationCount(), targetIterations);

            LeverageLoop loop = LeverageLoop.builder()
                    .loopId(newLoopId())
                    .initialCapitalUsd(initialCapitalUsd)
                    .collateralToken(collateralToken)
                    .iterations(0)
                    .maxIterations(iterations)
                    .currentLeverageRatio(BigDecimal.ONE)
                    .totalExposureUsd(BigDecimal.ZERO)
                    .lentAmountUsd(BigDecimal.ZERO)
                    .borrowingProtocol(borrowingProtocol != null ? borrowingProtocol : loopSettings.getDefaultProtocol())
                    .lendingProtocol(lendingProtocol != null ? lendingProtocol : loopSettings.getDefaultProtocol())
                    .status(LoopStatus.ACTIVE)
                    .healthScore(BigDecimal.ONE)
                    .createdAt(LocalDateTime.now())
                    .build();
            positionStore.saveLoop(loop);

            log.info(
                    "Opened loop {}: {} USD {} collateral, {} iterations (sizing {}x), borrow on {}, lend on {}",
                    loop.getLoopId(),
                    initialCapitalUsd,
                    collateralToken.getSymbol(),
                    iterations,
                    sizing.getLeverageRatio(),
                    loop.getBorrowingProtocol(),
                    loop.getLendingProtocol());
            publish(LoopEventType.LOOP_OPENED, loop);

            activeLoopRegistry.beginDeployment(loop);
            try {
                return activeLoopRegistry.withLock(loop.getLoopId(), () -> runLoop(loop));
            } finally {
                activeLoopRegistry.endDeployment(loop.getLoopId());
            }

        } catch (Exception e) {
            log.error("Leverage loop deployment of {} USD failed", initialCapitalUsd, e);
            return null;
        }
    }

    private LeverageLoop runLoop(LeverageLoop loop) {
        LoopRun run = new LoopRun(loop.getInitialCapitalUsd());

        IterationOutcome outcome = IterationOutcome.CONTINUE;
        for (int i = 1; i <= loop.getMaxIterations() && !outcome.isStop(); i++) {
            outcome = runIteration(loop, i, run);
        }
        if (outcome.isStop()) {
            log.warn("Loop {} stopped early after {} iteration(s): {}", loop.getLoopId(), loop.getIterations(), outcome);
        }

        finalizeLoop(loop, run);
        return loop;
    }

    private IterationOutcome runIteration(LeverageLoop loop, int iteration, LoopRun run) {
        try {
            BigDecimal maxBorrowingPower = run.totalCollateralUsd.multiply(MAX_LTV);
            BigDecimal capacity = maxBorrowingPower.subtract(run.cumulativeDebtUsd);
            if (capacity.signum() <= 0) {
                log.info("Loop {} has no borrow capacity left at iteration {}", loop.getLoopId(), iteration);
                return IterationOutcome.STOP_CAPACITY;
            }
            BigDecimal borrowAmount = capacity.min(maxBorrowingPower);

            ProtocolResult borrow = protocolGateway.borrow(
                    borrowAmount, loop.getCollateralToken(), loop.getBorrowingProtocol(), loopSettings.getSlippageBps());
            switch (borrow.getOutcome()) {
                case OK:
                    break;
                case INSUFFICIENT_LIQUIDITY:
                case PROTOCOL_ERROR:
                    log.warn(
                            "Borrow of {} USD failed at iteration {} of loop {}: {}",
                            borrowAmount,
                            iteration,
                            loop.getLoopId(),
                            borrow.describe());
                    return IterationOutcome.STOP_BORROW_FAILED;
                default:
                    throw new IllegalStateException("Unhandled borrow outcome " + borrow.getOutcome());
            }

            run.cumulativeDebtUsd = run.cumulativeDebtUsd.add(borrowAmount);
            IterationOutcome outcome;
            try {
                outcome = afterBorrow(loop, iteration, borrowAmount, run);
            } catch (Exception e) {
                log.error(
                        "Iteration {} of loop {} failed after borrowing {} USD, keeping the borrow on record",
                        iteration,
                        loop.getLoopId(),
                        borrowAmount,
                        e);
                outcome = IterationOutcome.STOP_ERROR;
            }
            recordPosition(loop, iteration, borrowAmount, run);
            return outcome;

        } catch (Exception e) {
            log.error("Iteration {} of loop {} failed", iteration, loop.getLoopId(), e);
            return IterationOutcome.STOP_ERROR;
        }
    }

    /**
     * Ledger entry and collateral swap for a borrow that already went through. Whatever
     * happens here, the caller records the position so the debt stays tracked.
     */
    private IterationOutcome afterBorrow(LeverageLoop loop, int iteration, BigDecimal borrowAmount, LoopRun run) {
        transactionLog.recordTransaction(
                LedgerAction.BORROW,
                CollateralToken.USDC.getAssetId(),
                borrowAmount,
                borrowAmount,
                loop.getBorrowingProtocol(),
                TransactionLog.AGENT_TAG,
                loop.getLoopId());

        if (!loopSettings.isRecursiveEnabled() || !loopSettings.isSwapEnabled()) {
            return IterationOutcome.CONTINUE;
        }

        SwapResult swap;
        try {
            swap = collateralSwapAdapter.swapToCollateral(borrowAmount, loop.getCollateralToken());
        } catch (Exception e) {
            log.warn(
                    "Swap of {} USD into {} threw at iteration {} of loop {}",
                    borrowAmount,
                    loop.getCollateralToken().getSymbol(),
                    iteration,
                    loop.getLoopId(),
                    e);
            return IterationOutcome.STOP_SWAP_FAILED;
        }
        if (swap == null || !swap.isUsable()) {
            log.warn(
                    "Swap of {} USD into {} failed at iteration {} of loop {}: {}",
                    borrowAmount,
                    loop.getCollateralToken().getSymbol(),
                    iteration,
                    loop.getLoopId(),
                    swap != null ? swap.getFailureReason() : "no result");
            return IterationOutcome.STOP_SWAP_FAILED;
        }

        run.totalCollateralUsd = run.totalCollateralUsd.add(swap.getReceivedUsd());
        transactionLog.recordTransaction(
                LedgerAction.SWAP,
                loop.getCollateralToken().getAssetId(),
                swap.getReceivedAmount(),
                swap.getReceivedUsd(),
                SWAP_VENUE,
                TransactionLog.AGENT_TAG,
                loop.getLoopId());
        return IterationOutcome.CONTINUE;
    }

    private void recordPosition(LeverageLoop loop, int iteration, BigDecimal borrowAmount, LoopRun run) {
        LocalDateTime now = LocalDateTime.now();
        LeveragePosition position = LeveragePosition.builder()
                .positionId(loop.getLoopId() + "_iter_" + iteration)
                .loopId(loop.getLoopId())
                .iteration(iteration)
                .collateralToken(loop.getCollateralToken())
                .collateralAmountUsd(run.totalCollateralUsd)
                .borrowedAmountUsd(borrowAmount)
                .lendingProtocol(loop.getLendingProtocol())
                .borrowingProtocol(loop.getBorrowingProtocol())
                .liquidationThreshold(LoopHealthMonitor.LIQUIDATION_THRESHOLD)
                .currentCollateralRatio(collateralRatio(run.totalCollateralUsd, run.cumulativeDebtUsd))
                .healthScore(BigDecimal.ONE)
                .status(PositionStatus.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .build();

        activeLoopRegistry.withAssetLock(loop.getCollateralToken().getAssetId(), () -> {
            loop.getPositions().add(position);
            loop.setIterations(loop.getPositions().size());
            loop.setTotalExposureUsd(run.cumulativeDebtUsd);
            loop.setCurrentLeverageRatio(leverageRatio(run.cumulativeDebtUsd, loop.getInitialCapitalUsd()));

            ReservedBalance reservation = reservationCalculator.forIteration(loop);
            positionStore.recordIteration(position, loop, reservation);
            return reservation;
        });

        log.info(
                "Loop {} iteration {}: borrowed {} USD, collateral {} USD, debt {} USD, ratio {}",
                loop.getLoopId(),
                iteration,
                borrowAmount,
                run.totalCollateralUsd,
                run.cumulativeDebtUsd,
                position.getCurrentCollateralRatio());
        publish(LoopEventType.ITERATION_COMPLETED, loop);
    }

    private void finalizeLoop(LeverageLoop loop, LoopRun run) {
        if (run.cumulativeDebtUsd.signum() > 0 && loop.getIterations() > 0) {
            lendConsolidated(loop, run.cumulativeDebtUsd);
        }

        loop.setCurrentLeverageRatio(leverageRatio(run.cumulativeDebtUsd, loop.getInitialCapitalUsd()));
        loop.setStatus(loop.getIterations() == loop.getMaxIterations() ? LoopStatus.COMPLETED : LoopStatus.PARTIAL);
        loopHealthMonitor.monitorLoopHealth(loop);
        activeLoopRegistry.withAssetLock(loop.getCollateralToken().getAssetId(), () -> {
            // rebuilt from every committed loop holding the asset
            ReservedBalance reservation = loop.getLastPosition() != null ? reservationCalculator.forIteration(loop) : null;
            positionStore.saveFinalizedLoop(loop, reservation);
            return activeLoopRegistry.register(loop);
        });

        log.info(
                "Loop {} {}: {} iteration(s), exposure {} USD, leverage {}x, lent {} USD",
                loop.getLoopId(),
                loop.getStatus(),
                loop.getIterations(),
                loop.getTotalExposureUsd(),
                loop.getCurrentLeverageRatio(),
                loop.getLentAmountUsd());
        publish(LoopEventType.LOOP_FINALIZED, loop);
    }

    private void lendConsolidated(LeverageLoop loop, BigDecimal amountUsd) {
        try {
            ProtocolResult lend = protocolGateway.lend(amountUsd, loop.getLendingProtocol(), loopSettings.getSlippageBps());
            if (lend.isOk()) {
                loop.setLentAmountUsd(amountUsd);
                transactionLog.recordTransaction(
                        LedgerAction.LEND,
                        CollateralToken.USDC.getAssetId(),
                        amountUsd,
                        amountUsd,
                        loop.getLendingProtocol(),
                        TransactionLog.AGENT_TAG,
                        loop.getLoopId());
            } else {
                log.warn(
                        "Consolidated lend of {} USD on {} failed for loop {}, borrowed funds are idle: {}",
                        amountUsd,
                        loop.getLendingProtocol(),
                        loop.getLoopId(),
                        lend.describe());
            }
        } catch (Exception e) {
            log.warn("Consolidated lend for loop {} threw, borrowed funds are idle", loop.getLoopId(), e);
        }
    }

    // ========================
    // SIZING, HEALTH, UNWIND
    // ========================

    public LeverageSizing calculateSafeLeverage(
            Map<CollateralToken, BigDecimal> availableCapital, MarketSentiment sentiment) {
        return leverageSizingCalculator.calculateSafeLeverage(availableCapital, sentiment);
    }

    public BigDecimal monitorLoopHealth(LeverageLoop loop) {
        return loopHealthMonitor.monitorLoopHealth(loop);
    }

    public boolean unwindLoop(LeverageLoop loop, boolean emergency) {
        return loopUnwindService.unwindLoop(loop, emergency);
    }

    public int emergencyUnwindAllLoops() {
        return loopUnwindService.emergencyUnwindAllLoops();
    }

    // ========================
    // QUERIES
    // ========================

    public LoopsSummary getActiveLoopsSummary() {
        List<LeverageLoop> loops = activeLoopRegistry.getActiveLoops();
        loops.sort(Comparator.comparing(LeverageLoop::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));

        BigDecimal totalExposure = BigDecimal.ZERO;
        BigDecimal leverageSum = BigDecimal.ZERO;
        int totalPositions = 0;
        List<LoopsSummary.LoopSummary> details = new ArrayList<>();

        for (LeverageLoop loop : loops) {
            totalExposure = totalExposure.add(loop.getTotalExposureUsd());
            leverageSum = leverageSum.add(loop.getCurrentLeverageRatio());
            totalPositions += loop.getPositions().size();
            details.add(LoopsSummary.LoopSummary.builder()
                    .loopId(loop.getLoopId())
                    .iterations(loop.getIterations())
                    .leverageRatio(loop.getCurrentLeverageRatio())
                    .exposureUsd(loop.getTotalExposureUsd())
                    .healthScore(loop.getHealthScore())
                    .status(loop.getStatus())
                    .build());
        }

        BigDecimal averageLeverage = loops.isEmpty()
                ? BigDecimal.ZERO
                : leverageSum.divide(BigDecimal.valueOf(loops.size()), RATIO_SCALE, RoundingMode.HALF_UP);

        return LoopsSummary.builder()
                .activeLoops(loops.size())
                .totalExposureUsd(totalExposure)
                .totalPositions(totalPositions)
                .averageLeverage(averageLeverage)
                .loops(details)
                .build();
    }

    public List<LeverageLoop> getActiveLoops() {
        return activeLoopRegistry.getActiveLoops();
    }

    public Optional<LeverageLoop> findLoop(String loopId) {
        return activeLoopRegistry.findLoop(loopId);
    }

    // ========================
    // HELPERS
    // ========================

    static BigDecimal collateralRatio(BigDecimal collateralUsd, BigDecimal debtUsd) {
        if (debtUsd.signum() == 0) {
            return LoopHealthMonitor.HEALTHY_RATIO;
        }
        return collateralUsd.divide(debtUsd, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal leverageRatio(BigDecimal debtUsd, BigDecimal initialCapitalUsd) {
        if (debtUsd.signum() == 0) {
            return BigDecimal.ONE;
        }
        return debtUsd.divide(initialCapitalUsd, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    private static String newLoopId() {
        return "loop_" + System.currentTimeMillis() + "_"
                + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private void publish(LoopEventType type, LeverageLoop loop) {
        applicationEventPublisher.publishEvent(new LoopEvent(
                this, type, loop.getLoopId(), loop.getStatus(), loop.getIterations(), loop.getTotalExposureUsd()));
    }

    /** Running totals of one deployment. Only touched under the loop's lock. */
    private static final class LoopRun {
        private BigDecimal totalCollateralUsd;
        private BigDecimal cumulativeDebtUsd = BigDecimal.ZERO;

        private LoopRun(BigDecimal initialCollateralUsd) {
            this.totalCollateralUsd = initialCollateralUsd;
        }
    }
}
