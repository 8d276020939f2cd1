package com.leverageloop.observability;

import com.leverageloop.engine.ActiveLoopRegistry;
import com.leverageloop.event.LoopEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for leverage loops.
 * <ul>
 *   <li><b>loops.opened</b> (counter): loops that passed the safety gate and started deploying</li>
 *   <li><b>loops.unwound</b> (counter): successful unwinds</li>
 *   <li><b>loops.unwind.failed</b> (counter): aborted unwinds</li>
 *   <li><b>loops.active</b> (gauge): size of the active map</li>
 *   <li><b>loops.exposure.usd</b> (gauge): total exposure of active loops</li>
 * </ul>
 */
@Service
public class LoopMetricsService {

    private final Counter loopsOpenedCounter;
    private final Counter loopsUnwoundCounter;
    private final Counter unwindFailedCounter;

    public LoopMetricsService(MeterRegistry meterRegistry, ActiveLoopRegistry activeLoopRegistry) {
        this.loopsOpenedCounter = Counter.builder("loops.opened")
                .description("Leverage loops opened")
                .register(meterRegistry);

        this.loopsUnwoundCounter = Counter.builder("loops.unwound")
                .description("Leverage loops unwound and retired")
                .register(meterRegistry);

        this.unwindFailedCounter = Counter.builder("loops.unwind.failed")
                .description("Unwind attempts aborted before retirement")
                .register(meterRegistry);

        meterRegistry.gauge("loops.active", activeLoopRegistry, ActiveLoopRegistry::getActiveLoopCount);
        meterRegistry.gauge("loops.exposure.usd", activeLoopRegistry, registry -> registry.getTotalExposureUsd()
                .doubleValue());
    }

    @EventListener
    @Order(20)
    public void onLoopEvent(LoopEvent event) {
        switch (event.getEventType()) {
            case LOOP_OPENED:
                loopsOpenedCounter.increment();
                break;
            case LOOP_UNWOUND:
                loopsUnwoundCounter.increment();
                break;
            case UNWIND_FAILED:
                unwindFailedCounter.increment();
                break;
            default:
                break;
        }
    }
}
