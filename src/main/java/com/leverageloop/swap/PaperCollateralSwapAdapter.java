package com.leverageloop.swap;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.oracle.PriceOracle;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper-trading swap. Prices the fill off the SOL price (stSOL is treated as staked
 * SOL at 1:1) and deducts a fixed slippage from the USD received.
 */
@Component
@ConditionalOnProperty(name = "leverage.paper-trading", havingValue = "true", matchIfMissing = true)
public class PaperCollateralSwapAdapter implements CollateralSwapAdapter {

    private static final Logger log = LoggerFactory.getLogger(PaperCollateralSwapAdapter.class);

    private final PriceOracle priceOracle;
    private final BigDecimal slippage;

    public PaperCollateralSwapAdapter(
            PriceOracle priceOracle, @Value("${leverage.paper.swap-slippage:0.005}") BigDecimal slippage) {
        this.priceOracle = priceOracle;
        this.slippage = slippage;
    }

    @Override
    public SwapResult swapToCollateral(BigDecimal usdAmount, CollateralToken target) {
        if (!target.isSwapTarget()) {
            log.warn("Swap target {} is not supported, only SOL and stSOL", target.getSymbol());
            return SwapResult.failed("Unsupported swap target " + target.getSymbol());
        }

        Optional<BigDecimal> solPrice = priceOracle.getPrice(CollateralToken.SOL.getAssetId());
        if (solPrice.isEmpty() || solPrice.get().signum() <= 0) {
            log.warn("No SOL price available, cannot swap {} USD", usdAmount);
            return SwapResult.failed("SOL price unavailable");
        }

        BigDecimal solAmount = usdAmount.divide(solPrice.get(), 9, RoundingMode.HALF_UP);
        BigDecimal receivedUsd = usdAmount.multiply(BigDecimal.ONE.subtract(slippage));

        log.info(
                "PAPER: swap {} USDC -> {} {} (received {} USD)", usdAmount, solAmount, target.getSymbol(), receivedUsd);
        return SwapResult.success(receivedUsd, solAmount);
    }
}
