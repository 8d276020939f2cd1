package com.leverageloop.safety;

import com.leverageloop.domain.enums.SafetyRiskLevel;
import lombok.Getter;
import lombok.ToString;

/**
 * Verdict of the safety gate for a proposed DeFi operation.
 *
 * <p>A result can be safe and still carry a WARNING level (for example a thin SOL fee
 * reserve); only {@link #isSafe()} decides whether the operation may proceed.
 */
@Getter
@ToString
public class SafetyCheckResult {

    private final boolean safe;
    private final String reason;
    private final SafetyRiskLevel riskLevel;
    private final String recommendedAction;

    private SafetyCheckResult(boolean safe, String reason, SafetyRiskLevel riskLevel, String recommendedAction) {
        this.safe = safe;
        this.reason = reason;
        this.riskLevel = riskLevel;
        this.recommendedAction = recommendedAction;
    }

    public static SafetyCheckResult passed() {
        return new SafetyCheckResult(true, "All safety checks passed", SafetyRiskLevel.SAFE, null);
    }

    public static SafetyCheckResult passedWithWarning(String reason, String recommendedAction) {
        return new SafetyCheckResult(true, reason, SafetyRiskLevel.WARNING, recommendedAction);
    }

    public static SafetyCheckResult blocked(String reason, SafetyRiskLevel riskLevel, String recommendedAction) {
        return new SafetyCheckResult(false, reason, riskLevel, recommendedAction);
    }
}
