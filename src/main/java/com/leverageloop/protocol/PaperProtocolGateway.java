package com.leverageloop.protocol;

import com.leverageloop.domain.enums.CollateralToken;
import java.math.BigDecimal;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper-trading gateway: every call settles immediately with a synthetic transaction id.
 */
@Component
@ConditionalOnProperty(name = "leverage.paper-trading", havingValue = "true", matchIfMissing = true)
public class PaperProtocolGateway implements ProtocolGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperProtocolGateway.class);

    @Override
    public ProtocolResult borrow(BigDecimal amountUsd, CollateralToken collateral, String protocol, int slippageBps) {
        log.info("PAPER: borrow {} USD against {} on {}", amountUsd, collateral.getSymbol(), protocol);
        return settle();
    }

    @Override
    public ProtocolResult lend(BigDecimal amountUsd, String protocol, int slippageBps) {
        log.info("PAPER: lend {} USD on {}", amountUsd, protocol);
        return settle();
    }

    @Override
    public ProtocolResult repay(BigDecimal amountUsd, CollateralToken collateral, String protocol, int slippageBps) {
        log.info("PAPER: repay {} USD ({}) on {}", amountUsd, collateral.getSymbol(), protocol);
        return settle();
    }

    @Override
    public ProtocolResult withdraw(BigDecimal amountUsd, String protocol, int slippageBps) {
        log.info("PAPER: withdraw {} USD from {}", amountUsd, protocol);
        return settle();
    }

    private ProtocolResult settle() {
        return ProtocolResult.ok("paper-" + UUID.randomUUID());
    }
}
