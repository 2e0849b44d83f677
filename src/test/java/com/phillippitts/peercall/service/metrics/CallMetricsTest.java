package com.phillippitts.peercall.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CallMetricsTest {

    private MeterRegistry registry;
    private CallMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CallMetrics(registry);
    }

    @Test
    void shouldTagTransitionsWithBothStates() {
        metrics.recordTransition("IDLE", "DIALING");
        metrics.recordTransition("IDLE", "DIALING");

        Counter counter = registry.find("peercall.call.transition")
                .tag("from", "IDLE")
                .tag("to", "DIALING")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    void shouldCountSuppressedEventsPerReason() {
        metrics.incrementSuppressed("call:incoming", "race_guard");
        metrics.incrementSuppressed("call:incoming", "busy");

        assertThat(metrics.count("call.suppressed", "reason", "race_guard")).isEqualTo(1.0);
        assertThat(metrics.count("call.suppressed", "reason", "busy")).isEqualTo(1.0);
    }

    @Test
    void shouldCountErrorsMissesAndRetries() {
        metrics.incrementError("ROOM_FULL");
        metrics.incrementMissed();
        metrics.incrementAckRetry("call:initiate");

        assertThat(metrics.count("call.error", "kind", "ROOM_FULL")).isEqualTo(1.0);
        assertThat(metrics.count("call.missed")).isEqualTo(1.0);
        assertThat(metrics.count("signaling.ack.retry", "event", "call:initiate")).isEqualTo(1.0);
    }

    @Test
    void unknownCounterReadsZero() {
        assertThat(metrics.count("call.error", "kind", "OFFLINE")).isZero();
    }
}
