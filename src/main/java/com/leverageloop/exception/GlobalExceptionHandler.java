package com.leverageloop.exception;

import com.leverageloop.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures to {@link ApiErrorResponse}. Errors raised under {@code /api/loops/{loopId}}
 * carry that loop id even when the exception itself does not.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final Pattern LOOP_PATH = Pattern.compile("^/api/loops/([^/]+)(/.*)?$");

    // collection endpoints that share the /api/loops/ prefix
    private static final Set<String> NON_LOOP_SEGMENTS = Set.of("summary", "reserved-balances", "emergency-unwind");

    private final boolean paperTrading;

    public GlobalExceptionHandler(@Value("${leverage.paper-trading:true}") boolean paperTrading) {
        this.paperTrading = paperTrading;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        log.warn("Rejected loop request on {}: {}", request.getRequestURI(), details);
        return respond(ErrorCode.VALIDATION_ERROR, "Loop request failed validation", null, details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable body on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return respond(ErrorCode.BAD_REQUEST, "Malformed request body", null, null, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parameter", ex.getName());
        details.put("value", String.valueOf(ex.getValue()));
        return respond(ErrorCode.BAD_REQUEST, "Invalid value for " + ex.getName(), null, details, request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleLoopFailure(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        String loopId = ex.getLoopId() != null ? ex.getLoopId() : loopIdFromPath(request.getRequestURI());
        if (errorCode.getHttpStatus() >= 500) {
            log.error("{} on loop {}: {}", errorCode.getCode(), loopId, ex.getMessage(), ex);
        } else {
            log.warn("{} on loop {}: {}", errorCode.getCode(), loopId, ex.getMessage());
        }
        return respond(errorCode, ex.getMessage(), loopId, ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, null, request);
    }

    private ResponseEntity<ApiErrorResponse> respond(
            ErrorCode errorCode,
            String message,
            String loopId,
            Map<String, Object> details,
            HttpServletRequest request) {
        String path = request.getRequestURI();
        String resolvedLoopId = loopId != null ? loopId : loopIdFromPath(path);
        return ResponseEntity.status(errorCode.getHttpStatus())
                .body(ApiErrorResponse.of(errorCode, message, resolvedLoopId, details, path, paperTrading));
    }

    static String loopIdFromPath(String path) {
        if (path == null) {
            return null;
        }
        Matcher matcher = LOOP_PATH.matcher(path);
        if (!matcher.matches() || NON_LOOP_SEGMENTS.contains(matcher.group(1))) {
            return null;
        }
        return matcher.group(1);
    }
}
