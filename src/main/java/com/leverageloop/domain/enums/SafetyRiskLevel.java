package com.leverageloop.domain.enums;

/**
 * Risk level reported by the portfolio safety gate alongside its verdict.
 */
public enum SafetyRiskLevel {
    SAFE,
    WARNING,
    DANGER
}
