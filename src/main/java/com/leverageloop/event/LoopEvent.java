package com.leverageloop.event;

import com.leverageloop.domain.enums.LoopStatus;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Lifecycle notification for a leverage loop. Carries a snapshot of the values that
 * listeners (metrics, audit) need, not the mutable loop itself.
 */
public class LoopEvent extends ApplicationEvent {

    private final LoopEventType eventType;
    private final String loopId;
    private final LoopStatus status;
    private final int iterations;
    private final BigDecimal totalExposureUsd;

    public LoopEvent(
            Object source,
            LoopEventType eventType,
            String loopId,
            LoopStatus status,
            int iterations,
            BigDecimal totalExposureUsd) {
        super(source);
        this.eventType = eventType;
        this.loopId = loopId;
        this.status = status;
        this.iterations = iterations;
        this.totalExposureUsd = totalExposureUsd;
    }

    public LoopEventType getEventType() {
        return eventType;
    }

    public String getLoopId() {
        return loopId;
    }

    public LoopStatus getStatus() {
        return status;
    }

    public int getIterations() {
        return iterations;
    }

    public BigDecimal getTotalExposureUsd() {
        return totalExposureUsd;
    }
}
