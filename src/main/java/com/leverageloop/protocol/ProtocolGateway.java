package com.leverageloop.protocol;

import com.leverageloop.domain.enums.CollateralToken;
import java.math.BigDecimal;

/**
 * Borrow/lend/repay/withdraw against a named lending protocol.
 *
 * <p>Expected rejections are returned as a non-OK {@link ProtocolResult}. Transport
 * failures may surface as {@link com.leverageloop.exception.ProtocolException}.
 * Implementations own their own timeouts and retries.
 */
public interface ProtocolGateway {

    ProtocolResult borrow(BigDecimal amountUsd, CollateralToken collateral, String protocol, int slippageBps);

    ProtocolResult lend(BigDecimal amountUsd, String protocol, int slippageBps);

    ProtocolResult repay(BigDecimal amountUsd, CollateralToken collateral, String protocol, int slippageBps);

    ProtocolResult withdraw(BigDecimal amountUsd, String protocol, int slippageBps);
}
