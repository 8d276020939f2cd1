package com.leverageloop.exception;

import java.util.Map;

/**
 * Thrown by protocol and swap adapters for transport-level failures (timeouts, RPC errors)
 * that are not an ordinary protocol rejection. Expected rejections are returned as
 * results instead.
 */
public class ProtocolException extends BaseException {

    public ProtocolException(String message) {
        super(ErrorCode.PROTOCOL_ERROR, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorCode.PROTOCOL_ERROR, message, cause);
    }

    public ProtocolException(String protocol, String operation, String message) {
        super(
                ErrorCode.PROTOCOL_ERROR,
                String.format("%s %s failed: %s", protocol, operation, message),
                Map.of("protocol", protocol, "operation", operation));
    }
}
