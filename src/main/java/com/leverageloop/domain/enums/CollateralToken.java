package com.leverageloop.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Assets accepted as loop collateral.
 *
 * <p>The asset id keys the reserved-balance table and the price oracle. Only SOL and
 * stSOL can be acquired by swapping borrowed stable value back into collateral.
 */
@Getter
@RequiredArgsConstructor
public enum CollateralToken {
    SOL("SOL", "So11111111111111111111111111111111111111112", true),
    STSOL("stSOL", "STAKED_SOL_So11111111111111111111111111111111111111112", true),
    USDC("USDC", "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v", false);

    private final String symbol;
    private final String assetId;
    private final boolean swapTarget;
}
