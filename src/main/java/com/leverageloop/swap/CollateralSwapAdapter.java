package com.leverageloop.swap;

import com.leverageloop.domain.enums.CollateralToken;
import java.math.BigDecimal;

/**
 * Converts USD of borrowed stable asset into a collateral token.
 */
public interface CollateralSwapAdapter {

    SwapResult swapToCollateral(BigDecimal usdAmount, CollateralToken target);
}
