package com.leverageloop.domain.enums;

/**
 * Market outlook supplied by the advisor. Scales the sizing limits before the hard caps apply.
 */
public enum MarketSentiment {
    BULLISH,
    NEUTRAL,
    BEARISH
}
