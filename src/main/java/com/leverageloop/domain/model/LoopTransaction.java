package com.leverageloop.domain.model;

import com.leverageloop.domain.enums.LedgerAction;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * One append-only accounting row for a protocol or swap action of a loop.
 */
@Data
@Builder
public class LoopTransaction {

    private Long id;
    private LedgerAction action;
    private String assetId;
    private BigDecimal amount;
    private BigDecimal amountUsd;
    private String protocol;
    private String agentTag;
    private String loopId;
    private LocalDateTime createdAt;
}
