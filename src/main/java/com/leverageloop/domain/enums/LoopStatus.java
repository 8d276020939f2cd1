package com.leverageloop.domain.enums;

import java.util.List;

/**
 * Lifecycle status of a leverage loop.
 *
 * <p>ACTIVE while the borrow phase runs, then COMPLETED or PARTIAL once it ends.
 * UNWINDING and EMERGENCY are terminal: the loop has been retired to history.
 */
public enum LoopStatus {
    ACTIVE,
    COMPLETED,
    PARTIAL,
    UNWINDING,
    EMERGENCY;

    /** Statuses that still belong in the active set and are restored on restart. */
    public static final List<LoopStatus> LIVE = List.of(ACTIVE, COMPLETED, PARTIAL);

    public boolean isTerminal() {
        return this == UNWINDING || this == EMERGENCY;
    }
}
