package com.leverageloop.swap;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of swapping borrowed stable value into collateral.
 * On success {@code receivedUsd} is the USD value of collateral actually acquired.
 */
@Getter
@ToString
public class SwapResult {

    private final boolean success;
    private final BigDecimal receivedUsd;
    private final BigDecimal receivedAmount;
    private final String failureReason;

    private SwapResult(boolean success, BigDecimal receivedUsd, BigDecimal receivedAmount, String failureReason) {
        this.success = success;
        this.receivedUsd = receivedUsd;
        this.receivedAmount = receivedAmount;
        this.failureReason = failureReason;
    }

    public static SwapResult success(BigDecimal receivedUsd, BigDecimal receivedAmount) {
        return new SwapResult(true, receivedUsd, receivedAmount, null);
    }

    public static SwapResult failed(String reason) {
        return new SwapResult(false, BigDecimal.ZERO, BigDecimal.ZERO, reason);
    }

    /** Success with a positive amount; a zero-value fill counts as a failure for loop purposes. */
    public boolean isUsable() {
        return success && receivedUsd != null && receivedUsd.signum() > 0;
    }
}
