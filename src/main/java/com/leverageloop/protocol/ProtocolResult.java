package com.leverageloop.protocol;

import com.leverageloop.domain.enums.ProtocolOutcome;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a lending-protocol call.
 *
 * <p>Either OK with the settlement transaction id, or a failure outcome with a reason.
 * Callers branch on {@link #getOutcome()} exhaustively.
 */
@Getter
@ToString
public class ProtocolResult {

    private final ProtocolOutcome outcome;
    private final String txId;
    private final String message;

    private ProtocolResult(ProtocolOutcome outcome, String txId, String message) {
        this.outcome = outcome;
        this.txId = txId;
        this.message = message;
    }

    public static ProtocolResult ok(String txId) {
        return new ProtocolResult(ProtocolOutcome.OK, txId, null);
    }

    public static ProtocolResult insufficientLiquidity(String message) {
        return new ProtocolResult(ProtocolOutcome.INSUFFICIENT_LIQUIDITY, null, message);
    }

    public static ProtocolResult protocolError(String message) {
        return new ProtocolResult(ProtocolOutcome.PROTOCOL_ERROR, null, message);
    }

    public boolean isOk() {
        return outcome == ProtocolOutcome.OK;
    }

    /** Human-readable description for logs. */
    public String describe() {
        switch (outcome) {
            case OK:
                return "ok (tx " + txId + ")";
            case INSUFFICIENT_LIQUIDITY:
                return "insufficient liquidity: " + message;
            case PROTOCOL_ERROR:
                return "protocol error: " + message;
            default:
                throw new IllegalStateException("Unhandled outcome " + outcome);
        }
    }
}
