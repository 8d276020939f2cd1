package com.leverageloop.oracle;

import com.leverageloop.domain.enums.CollateralToken;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Static prices for paper trading, one per collateral token.
 */
@Component
@ConditionalOnProperty(name = "leverage.paper-trading", havingValue = "true", matchIfMissing = true)
public class ConfiguredPriceOracle implements PriceOracle {

    private final Map<String, BigDecimal> pricesByAssetId;

    public ConfiguredPriceOracle(
            @Value("${leverage.paper.price.sol:150}") BigDecimal solPrice,
            @Value("${leverage.paper.price.stsol:165}") BigDecimal stSolPrice,
            @Value("${leverage.paper.price.usdc:1}") BigDecimal usdcPrice) {
        this.pricesByAssetId = Map.of(
                CollateralToken.SOL.getAssetId(), solPrice,
                CollateralToken.STSOL.getAssetId(), stSolPrice,
                CollateralToken.USDC.getAssetId(), usdcPrice);
    }

    @Override
    public Optional<BigDecimal> getPrice(String assetId) {
        return Optional.ofNullable(pricesByAssetId.get(assetId));
    }
}
