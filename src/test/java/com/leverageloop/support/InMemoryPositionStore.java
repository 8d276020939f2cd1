package com.leverageloop.support;

import com.leverageloop.domain.enums.LoopStatus;
import com.leverageloop.domain.enums.PositionStatus;
import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.LeveragePosition;
import com.leverageloop.domain.model.ReservedBalance;
import com.leverageloop.store.PositionStore;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Map-backed {@link PositionStore} for cross-component tests. Stores detached copies so a
 * simulated restart sees only what was written, not the live in-memory objects.
 */
public class InMemoryPositionStore implements PositionStore {

    private final Map<String, LeverageLoop> loops = new LinkedHashMap<>();
    private final Map<String, LeveragePosition> positions = new LinkedHashMap<>();
    private final Map<String, ReservedBalance> reservedBalances = new LinkedHashMap<>();

    @Override
    public synchronized void saveLoop(LeverageLoop loop) {
        loops.put(loop.getLoopId(), copyLoop(loop));
    }

    private void savePosition(LeveragePosition position) {
        positions.put(position.getPositionId(), copyPosition(position));
    }

    @Override
    public synchronized void recordIteration(
            LeveragePosition position, LeverageLoop loop, ReservedBalance reservedBalance) {
        savePosition(position);
        saveLoop(loop);
        if (reservedBalance != null) {
            updateReservedBalance(reservedBalance);
        }
    }

    @Override
    public synchronized void saveFinalizedLoop(LeverageLoop loop, ReservedBalance reservedBalance) {
        saveLoop(loop);
        if (reservedBalance != null) {
            updateReservedBalance(reservedBalance);
        }
    }

    @Override
    public synchronized void updatePositionStatus(String positionId, PositionStatus status) {
        LeveragePosition stored = positions.get(positionId);
        if (stored != null) {
            stored.setStatus(status);
            stored.setUpdatedAt(LocalDateTime.now());
        }
    }

    @Override
    public synchronized void retireLoop(
            LeverageLoop loop, List<ReservedBalance> remainingReservations, Collection<String> clearedAssetIds) {
        saveLoop(loop);
        remainingReservations.forEach(this::updateReservedBalance);
        clearedAssetIds.forEach(this::clearReservedBalance);
    }

    @Override
    public synchronized Optional<LeverageLoop> findLoop(String loopId) {
        return Optional.ofNullable(loops.get(loopId)).map(InMemoryPositionStore::copyLoop);
    }

    @Override
    public synchronized List<LeverageLoop> getActiveLoops() {
        return loops.values().stream()
                .filter(loop -> LoopStatus.LIVE.contains(loop.getStatus()))
                .map(InMemoryPositionStore::copyLoop)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<LeveragePosition> getActivePositions() {
        return positions.values().stream()
                .filter(position -> position.getStatus() == PositionStatus.ACTIVE)
                .map(InMemoryPositionStore::copyPosition)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<LeveragePosition> getPositionsForLoop(String loopId) {
        return positions.values().stream()
                .filter(position -> position.getLoopId().equals(loopId))
                .sorted(Comparator.comparingInt(LeveragePosition::getIteration))
                .map(InMemoryPositionStore::copyPosition)
                .collect(Collectors.toList());
    }

    private void updateReservedBalance(ReservedBalance reservedBalance) {
        reservedBalances.put(reservedBalance.getAssetId(), reservedBalance);
    }

    private void clearReservedBalance(String assetId) {
        reservedBalances.remove(assetId);
    }

    @Override
    public synchronized List<ReservedBalance> getReservedBalances() {
        return new ArrayList<>(reservedBalances.values());
    }

    private static LeverageLoop copyLoop(LeverageLoop loop) {
        return LeverageLoop.builder()
                .loopId(loop.getLoopId())
                .initialCapitalUsd(loop.getInitialCapitalUsd())
                .collateralToken(loop.getCollateralToken())
                .iterations(loop.getIterations())
                .maxIterations(loop.getMaxIterations())
                .currentLeverageRatio(loop.getCurrentLeverageRatio())
                .totalExposureUsd(loop.getTotalExposureUsd())
                .lentAmountUsd(loop.getLentAmountUsd())
                .fundsWithdrawn(loop.isFundsWithdrawn())
                .borrowingProtocol(loop.getBorrowingProtocol())
                .lendingProtocol(loop.getLendingProtocol())
                .status(loop.getStatus())
                .healthScore(loop.getHealthScore())
                .createdAt(loop.getCreatedAt())
                .closedAt(loop.getClosedAt())
                .build();
    }

    private static LeveragePosition copyPosition(LeveragePosition position) {
        return LeveragePosition.builder()
                .positionId(position.getPositionId())
                .loopId(position.getLoopId())
                .iteration(position.getIteration())
                .collateralToken(position.getCollateralToken())
                .collateralAmountUsd(position.getCollateralAmountUsd())
                .borrowedAmountUsd(position.getBorrowedAmountUsd())
                .lendingProtocol(position.getLendingProtocol())
                .borrowingProtocol(position.getBorrowingProtocol())
                .liquidationThreshold(position.getLiquidationThreshold())
                .currentCollateralRatio(position.getCurrentCollateralRatio())
                .healthScore(position.getHealthScore())
                .status(position.getStatus())
                .createdAt(position.getCreatedAt())
                .updatedAt(position.getUpdatedAt())
                .build();
    }
}
