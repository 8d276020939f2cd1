package com.leverageloop.event;

/**
 * Risk condition detected by the loop risk monitor.
 */
public enum RiskEventType {

    /** Loop health dropped below the warning threshold. */
    LOOP_HEALTH_DEGRADED,

    /** The monitor commanded an unwind of a single loop. */
    UNWIND_TRIGGERED,

    /** Deployable capital fell below the floor; every loop is being unwound. */
    CAPITAL_RESERVE_BREACH
}
