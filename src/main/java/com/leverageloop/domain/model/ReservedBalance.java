package com.leverageloop.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Capital earmarked as collateral for open loops, keyed by asset id.
 * Other trading components must treat the reserved amount as unavailable.
 */
@Data
@Builder
public class ReservedBalance {

    private String assetId;

    /** Reserved quantity in token units. */
    private BigDecimal reservedAmount;

    private BigDecimal reservedAmountUsd;
    private String reason;

    @Builder.Default
    private List<String> positionIds = new ArrayList<>();

    private LocalDateTime lastUpdated;
}
