package com.leverageloop.oracle;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * USD price per asset id. Empty when the price is unknown.
 */
public interface PriceOracle {

    Optional<BigDecimal> getPrice(String assetId);
}
