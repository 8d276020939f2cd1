package com.leverageloop.api.dto.request;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.MarketSentiment;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to deploy a new leverage loop.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenLoopRequest {

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal initialCapitalUsd;

    @NotNull
    private CollateralToken collateralToken;

    /** Optional; null disables the sentiment multiplier. */
    private MarketSentiment sentiment;

    @Min(1)
    private int targetIterations;

    /** Defaults to the configured protocol when null. */
    private String borrowingProtocol;

    private String lendingProtocol;
}
