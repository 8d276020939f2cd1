package com.leverageloop.ledger;

import com.leverageloop.domain.enums.LedgerAction;
import com.leverageloop.domain.model.LoopTransaction;
import java.math.BigDecimal;
import java.util.List;

/**
 * Append-only accounting record of every borrow, swap, lend, withdraw and repay.
 */
public interface TransactionLog {

    String AGENT_TAG = "defi";

    void recordTransaction(
            LedgerAction action,
            String assetId,
            BigDecimal amount,
            BigDecimal amountUsd,
            String protocol,
            String agentTag,
            String loopId);

    List<LoopTransaction> getTransactionsForLoop(String loopId);
}
