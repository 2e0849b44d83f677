package com.phillippitts.peercall.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics for the call layer.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>State transitions (from/to)</li>
 *   <li>Surfaced errors by kind</li>
 *   <li>Events deliberately dropped by the race guard or busy checks</li>
 *   <li>Missed calls recorded</li>
 *   <li>Acknowledgement retries per event</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class CallMetrics {

    private static final String METRIC_PREFIX = "peercall";

    private final MeterRegistry registry;

    public CallMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String from, String to) {
        Counter.builder(METRIC_PREFIX + ".call.transition")
                .description("Call state transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void incrementError(String kind) {
        Counter.builder(METRIC_PREFIX + ".call.error")
                .description("Call errors surfaced to the UI")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * @param reason why the event was dropped (race_guard, busy, on_call_screen, stale_call_id)
     */
    public void incrementSuppressed(String event, String reason) {
        Counter.builder(METRIC_PREFIX + ".call.suppressed")
                .description("Inbound events dropped on purpose")
                .tag("event", event)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementMissed() {
        Counter.builder(METRIC_PREFIX + ".call.missed")
                .description("Missed calls recorded in the ledger")
                .register(registry)
                .increment();
    }

    public void incrementAckRetry(String event) {
        Counter.builder(METRIC_PREFIX + ".signaling.ack.retry")
                .description("Acknowledged requests retried")
                .tag("event", event)
                .register(registry)
                .increment();
    }

    public double count(String name, String... tags) {
        Counter counter = registry.find(METRIC_PREFIX + "." + name).tags(tags).counter();
        return counter == null ? 0.0 : counter.count();
    }
}
