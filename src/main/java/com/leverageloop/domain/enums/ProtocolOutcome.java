package com.leverageloop.domain.enums;

/**
 * Outcome of a borrow, lend, repay or withdraw call against a lending protocol.
 */
public enum ProtocolOutcome {

    /** The operation settled. A transaction id is available. */
    OK,

    /** The protocol had no liquidity (or borrowing power) for the requested amount. */
    INSUFFICIENT_LIQUIDITY,

    /** The protocol rejected or failed the operation for any other reason. */
    PROTOCOL_ERROR
}
