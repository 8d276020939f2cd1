package com.leverageloop.event;

/**
 * Severity of a {@link RiskEvent}.
 */
public enum RiskLevel {

    /** Informational. No action taken. */
    INFO,

    /** Threshold breached; operator attention needed. */
    WARNING,

    /** Automatic protective action (unwind) was triggered. */
    CRITICAL
}
