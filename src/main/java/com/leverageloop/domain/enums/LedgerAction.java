package com.leverageloop.domain.enums;

/**
 * Kind of accounting row written to the transaction log.
 */
public enum LedgerAction {
    BORROW,
    SWAP,
    LEND,
    WITHDRAW,
    REPAY
}
