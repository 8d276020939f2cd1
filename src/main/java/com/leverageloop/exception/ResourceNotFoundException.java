package com.leverageloop.exception;

import java.util.Map;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        this(resourceType, identifier, null);
    }

    private ResourceNotFoundException(String resourceType, String identifier, String loopId) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s %s is neither active nor stored", resourceType, identifier),
                loopId,
                Map.of("resourceType", resourceType, "identifier", identifier));
    }

    public static ResourceNotFoundException loop(String loopId) {
        return new ResourceNotFoundException("Loop", loopId, loopId);
    }
}
