package com.leverageloop.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the loop engine's exception hierarchy. The {@link ErrorCode} picks the HTTP
 * status; {@code loopId} names the loop the failure concerns, when there is one.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String loopId;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, Map.of());
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, null, details);
    }

    protected BaseException(ErrorCode errorCode, String message, String loopId, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.loopId = loopId;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.loopId = null;
        this.details = Map.of();
    }
}
