package com.leverageloop.exception;

import com.leverageloop.domain.enums.CollateralToken;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request that is well-formed but refused by loop policy (safety gate, sizing, state).
 */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.LOOP_REJECTED, message);
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    /** Deployment that never produced a loop. Echoes the requested parameters back. */
    public static BusinessException loopNotOpened(
            BigDecimal initialCapitalUsd, CollateralToken collateralToken, int targetIterations) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("initialCapitalUsd", initialCapitalUsd);
        details.put("collateralToken", collateralToken);
        details.put("targetIterations", targetIterations);
        return new BusinessException(
                ErrorCode.LOOP_REJECTED,
                "Leverage loop was not opened; see logs for the rejection reason",
                details);
    }
}
