package com.leverageloop.domain.enums;

/**
 * Result of a single borrow/swap iteration of a leverage loop.
 * Any value other than CONTINUE ends the borrow phase.
 */
public enum IterationOutcome {
    CONTINUE,
    STOP_CAPACITY,
    STOP_BORROW_FAILED,
    STOP_SWAP_FAILED,
    STOP_ERROR;

    public boolean isStop() {
        return this != CONTINUE;
    }
}
