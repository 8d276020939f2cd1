package com.leverageloop.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.leverageloop.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Failure counterpart of {@link ApiResponse}: same {@code success} and
 * {@code paperTrading} flags, with the error in place of data.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final boolean paperTrading;
    private final LoopError error;

    private ApiErrorResponse(boolean paperTrading, LoopError error) {
        this.paperTrading = paperTrading;
        this.error = error;
    }

    public static ApiErrorResponse of(
            ErrorCode errorCode,
            String message,
            String loopId,
            Map<String, Object> details,
            String path,
            boolean paperTrading) {
        return new ApiErrorResponse(
                paperTrading,
                LoopError.builder()
                        .code(errorCode.getCode())
                        .message(message)
                        .loopId(loopId)
                        .details(details != null && !details.isEmpty() ? details : null)
                        .path(path)
                        .timestamp(Instant.now())
                        .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class LoopError {
        private final String code;
        private final String message;
        private final String loopId;
        private final Map<String, Object> details;
        private final String path;
        private final Instant timestamp;
    }
}
