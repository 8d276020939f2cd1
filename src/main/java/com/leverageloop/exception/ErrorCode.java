package com.leverageloop.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    LOOP_REJECTED("LOOP_REJECTED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    PROTOCOL_ERROR("PROTOCOL_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
