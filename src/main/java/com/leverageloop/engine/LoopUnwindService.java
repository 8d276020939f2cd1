package com.leverageloop.engine;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.LedgerAction;
import com.leverageloop.domain.enums.LoopStatus;
import com.leverageloop.domain.enums.PositionStatus;
import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.LeveragePosition;
import com.leverageloop.domain.model.ReservedBalance;
import com.leverageloop.event.LoopEvent;
import com.leverageloop.event.LoopEventType;
import com.leverageloop.ledger.TransactionLog;
import com.leverageloop.protocol.ProtocolGateway;
import com.leverageloop.protocol.ProtocolResult;
import com.leverageloop.store.PositionStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Executes the unwind of a leverage loop once a caller has decided to unwind it.
 *
 * <p><b>Sequence</b> (all under the loop's lock):
 * <ol>
 *   <li>One consolidated withdrawal of the total borrowed amount from the lending
 *       protocol. Failure aborts the unwind and leaves the loop untouched.</li>
 *   <li>LIFO repayment of each still-active position's incremental borrow. A failed repay
 *       leaves that position ACTIVE and moves on to the next one.</li>
 *   <li>Terminal status (UNWINDING or EMERGENCY), reservation cleanup and retirement
 *       to history, persisted in one store transaction.</li>
 * </ol>
 *
 * <p>Success means the withdrawal succeeded, however many repays failed. A retry of a
 * partially repaid loop skips the withdrawal (the loop remembers it) and only repays the
 * positions that are still open, so no position is ever repaid twice.
 */
@Service
public class LoopUnwindService {

    private static final Logger log = LoggerFactory.getLogger(LoopUnwindService.class);

    private final ActiveLoopRegistry activeLoopRegistry;
    private final PositionStore positionStore;
    private final ProtocolGateway protocolGateway;
    private final TransactionLog transactionLog;
    private final ReservationCalculator reservationCalculator;
    private final LoopSettings loopSettings;
    private final ApplicationEventPublisher applicationEventPublisher;

    public LoopUnwindService(
            ActiveLoopRegistry activeLoopRegistry,
            PositionStore positionStore,
            ProtocolGateway protocolGateway,
            TransactionLog transactionLog,
            ReservationCalculator reservationCalculator,
            LoopSettings loopSettings,
            ApplicationEventPublisher applicationEventPublisher) {
        this.activeLoopRegistry = activeLoopRegistry;
        this.positionStore = positionStore;
        this.protocolGateway = protocolGateway;
        this.transactionLog = transactionLog;
        this.reservationCalculator = reservationCalculator;
        this.loopSettings = loopSettings;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Unwinds one loop. Never throws; unexpected errors are logged and reported as false.
     */
    public boolean unwindLoop(LeverageLoop loop, boolean emergency) {
        try {
            return activeLoopRegistry.withLock(loop.getLoopId(), () -> doUnwind(loop, emergency));
        } catch (Exception e) {
            log.error("Unwind of loop {} failed unexpectedly", loop.getLoopId(), e);
            publish(LoopEventType.UNWIND_FAILED, loop);
            return false;
        }
    }

    /**
     * Emergency-unwinds every active loop. Works on a snapshot so loops retired during
     * the sweep do not disturb iteration. Returns the number of successful unwinds.
     */
    public int emergencyUnwindAllLoops() {
        List<LeverageLoop> snapshot = activeLoopRegistry.getActiveLoops();
        log.error("EMERGENCY UNWIND of {} active loops", snapshot.size());

        int unwound = 0;
        for (LeverageLoop loop : snapshot) {
            if (unwindLoop(loop, true)) {
                unwound++;
            }
        }

        log.warn("Emergency unwind finished: {}/{} loops unwound", unwound, snapshot.size());
        return unwound;
    }

    private boolean doUnwind(LeverageLoop loop, boolean emergency) {
        String loopId = loop.getLoopId();
        List<LeveragePosition> positions = loop.getPositions();
        log.info("Unwinding loop {} ({} positions, emergency={})", loopId, positions.size(), emergency);

        if (positions.isEmpty()) {
            retire(loop, emergency);
            return true;
        }

        if (!loop.isFundsWithdrawn()) {
            BigDecimal totalBorrowed = positions.stream()
                    .map(LeveragePosition::getBorrowedAmountUsd)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            String lendingProtocol = loop.getLendingProtocol() != null
                    ? loop.getLendingProtocol()
                    : positions.get(0).getLendingProtocol();

            ProtocolResult withdrawal =
                    protocolGateway.withdraw(totalBorrowed, lendingProtocol, loopSettings.getSlippageBps());
            if (!withdrawal.isOk()) {
                log.error(
                        "Withdrawal of {} USD from {} failed for loop {}: {}",
                        totalBorrowed,
                        lendingProtocol,
                        loopId,
                        withdrawal.describe());
                publish(LoopEventType.UNWIND_FAILED, loop);
                return false;
            }

            transactionLog.recordTransaction(
                    LedgerAction.WITHDRAW,
                    CollateralToken.USDC.getAssetId(),
                    totalBorrowed,
                    totalBorrowed,
                    lendingProtocol,
                    TransactionLog.AGENT_TAG,
                    loopId);
            loop.setFundsWithdrawn(true);
            positionStore.saveLoop(loop);
        } else {
            log.info("Funds for loop {} already withdrawn, resuming repayments", loopId);
        }

        int repaid = 0;
        for (int i = positions.size() - 1; i >= 0; i--) {
            LeveragePosition position = positions.get(i);
            if (!position.isActive()) {
                continue;
            }
            if (repay(loop, position)) {
                repaid++;
            }
        }

        long stillOpen = positions.stream().filter(LeveragePosition::isActive).count();
        if (stillOpen > 0) {
            log.warn("Loop {} unwound with {} position(s) still open after repayment failures", loopId, stillOpen);
        }
        log.info("Repaid {} position(s) of loop {}", repaid, loopId);

        retire(loop, emergency);
        return true;
    }

    private boolean repay(LeverageLoop loop, LeveragePosition position) {
        try {
            ProtocolResult result = protocolGateway.repay(
                    position.getBorrowedAmountUsd(),
                    position.getCollateralToken(),
                    position.getBorrowingProtocol(),
                    loopSettings.getSlippageBps());
            if (!result.isOk()) {
                log.warn(
                        "Repay of position {} ({} USD) failed: {}",
                        position.getPositionId(),
                        position.getBorrowedAmountUsd(),
                        result.describe());
                return false;
            }

            position.setStatus(PositionStatus.CLOSED);
            position.setUpdatedAt(LocalDateTime.now());
            positionStore.updatePositionStatus(position.getPositionId(), PositionStatus.CLOSED);
            transactionLog.recordTransaction(
                    LedgerAction.REPAY,
                    CollateralToken.USDC.getAssetId(),
                    position.getBorrowedAmountUsd(),
                    position.getBorrowedAmountUsd(),
                    position.getBorrowingProtocol(),
                    TransactionLog.AGENT_TAG,
                    loop.getLoopId());
            return true;

        } catch (Exception e) {
            log.warn("Repay of position {} threw, leaving it open", position.getPositionId(), e);
            return false;
        }
    }

    private void retire(LeverageLoop loop, boolean emergency) {
        if (!loop.getStatus().isTerminal()) {
            loop.setStatus(emergency ? LoopStatus.EMERGENCY : LoopStatus.UNWINDING);
            loop.setClosedAt(LocalDateTime.now());
        }

        Set<String> assetIds = new LinkedHashSet<>();
        for (LeveragePosition position : loop.getPositions()) {
            assetIds.add(position.getCollateralToken().getAssetId());
        }
        // positions of a loop all carry the loop's collateral token
        activeLoopRegistry.withAssetLock(loop.getCollateralToken().getAssetId(), () -> {
            List<ReservedBalance> remaining = reservationCalculator.remainingAfterRetirement(loop, assetIds);
            List<String> cleared = new ArrayList<>(assetIds);
            remaining.forEach(reservation -> cleared.remove(reservation.getAssetId()));

            positionStore.retireLoop(loop, remaining, cleared);
            activeLoopRegistry.retire(loop);
            return cleared;
        });

        log.info("Loop {} retired with status {}", loop.getLoopId(), loop.getStatus());
        publish(LoopEventType.LOOP_UNWOUND, loop);
    }

    private void publish(LoopEventType type, LeverageLoop loop) {
        applicationEventPublisher.publishEvent(new LoopEvent(
                this, type, loop.getLoopId(), loop.getStatus(), loop.getIterations(), loop.getTotalExposureUsd()));
    }
}
