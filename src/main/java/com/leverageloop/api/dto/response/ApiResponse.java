package com.leverageloop.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope for loop endpoints, applied by {@link com.leverageloop.config.ApiResponseAdvice}.
 * {@code paperTrading} tells the client whether the protocol and swap calls behind the
 * data were simulated.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final boolean paperTrading;
    private final T data;
    private final Instant timestamp = Instant.now();

    private ApiResponse(T data, boolean paperTrading) {
        this.data = data;
        this.paperTrading = paperTrading;
    }

    public static <T> ApiResponse<T> of(T data, boolean paperTrading) {
        return new ApiResponse<>(data, paperTrading);
    }
}
