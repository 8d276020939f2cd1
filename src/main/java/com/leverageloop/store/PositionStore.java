package com.leverageloop.store;

import com.leverageloop.domain.enums.PositionStatus;
import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.LeveragePosition;
import com.leverageloop.domain.model.ReservedBalance;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of loops, positions and reserved balances.
 *
 * <p>The composite methods {@link #recordIteration}, {@link #saveFinalizedLoop} and
 * {@link #retireLoop} write the reserved-balance change in the same transaction as the
 * state change it belongs to, so the reservation never disagrees with the positions on
 * disk.
 */
public interface PositionStore {

    void saveLoop(LeverageLoop loop);

    /**
     * Persists a new iteration: the position, the loop's running totals and the
     * updated reservation for the loop's collateral asset.
     */
    void recordIteration(LeveragePosition position, LeverageLoop loop, ReservedBalance reservedBalance);

    /**
     * Persists a loop's finalized totals and status together with its collateral
     * reservation. A null reservation (no positions) leaves reservations untouched.
     */
    void saveFinalizedLoop(LeverageLoop loop, ReservedBalance reservedBalance);

    void updatePositionStatus(String positionId, PositionStatus status);

    /**
     * Writes the terminal state of an unwound loop, rewrites the reservations other loops
     * still hold and clears the reservations of {@code clearedAssetIds}.
     */
    void retireLoop(
            LeverageLoop loop, List<ReservedBalance> remainingReservations, Collection<String> clearedAssetIds);

    Optional<LeverageLoop> findLoop(String loopId);

    /** Loops whose status is ACTIVE, COMPLETED or PARTIAL. Positions are not attached. */
    List<LeverageLoop> getActiveLoops();

    List<LeveragePosition> getActivePositions();

    List<LeveragePosition> getPositionsForLoop(String loopId);

    List<ReservedBalance> getReservedBalances();
}
