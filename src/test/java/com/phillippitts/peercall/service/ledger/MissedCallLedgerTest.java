package com.phillippitts.peercall.service.ledger;

import com.phillippitts.peercall.service.ledger.event.MissedCallRecordedEvent;
import com.phillippitts.peercall.service.metrics.CallMetrics;
import com.phillippitts.peercall.service.store.InMemoryKeyValueStore;
import com.phillippitts.peercall.service.store.KeyValueStore;
import com.phillippitts.peercall.testutil.EventCapturingPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MissedCallLedgerTest {

    private KeyValueStore store;
    private EventCapturingPublisher publisher;
    private CallMetrics metrics;
    private MissedCallLedger ledger;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        publisher = new EventCapturingPublisher();
        metrics = new CallMetrics(new SimpleMeterRegistry());
        ledger = new MissedCallLedger(store, publisher, metrics,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void resolvingMissedIncrementsOnceAndPublishes() {
        ledger.openOccurrence("c-1", "alice");

        assertThat(ledger.resolveMissed("c-1")).isTrue();
        assertThat(ledger.resolveMissed("c-1")).isFalse();

        assertThat(ledger.count("alice")).isEqualTo(1);
        assertThat(metrics.count("call.missed")).isEqualTo(1.0);
        MissedCallRecordedEvent event = publisher.lastOf(MissedCallRecordedEvent.class);
        assertThat(event.peerId()).isEqualTo("alice");
        assertThat(event.callId()).isEqualTo("c-1");
        assertThat(event.count()).isEqualTo(1);
    }

    @Test
    void remoteTimeoutThenLocalFallbackCountsOnce() {
        ledger.openOccurrence("c-1", "alice");

        ledger.resolveMissed("c-1");
        ledger.resolveMissed("c-1");

        assertThat(ledger.count("alice")).isEqualTo(1);
        assertThat(publisher.eventsOf(MissedCallRecordedEvent.class)).hasSize(1);
    }

    @Test
    void concurrentResolversRecordExactlyOneMiss() throws Exception {
        ledger.openOccurrence("c-1", "alice");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return ledger.resolveMissed("c-1");
                }));
            }
            start.countDown();
            int recorded = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    recorded++;
                }
            }
            assertThat(recorded).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(ledger.count("alice")).isEqualTo(1);
    }

    @Test
    void resolvingWithoutMissLeavesCounterUntouched() {
        ledger.openOccurrence("c-1", "alice");

        assertThat(ledger.resolveWithoutMiss("c-1")).isTrue();
        assertThat(ledger.resolveMissed("c-1")).isFalse();

        assertThat(ledger.count("alice")).isZero();
        assertThat(ledger.isOpen("c-1")).isFalse();
    }

    @Test
    void unopenedOccurrenceIsNeverCounted() {
        assertThat(ledger.resolveMissed("never-opened")).isFalse();
        assertThat(ledger.snapshot()).isEmpty();
    }

    @Test
    void countsAccumulatePerPeerAndResetIndividually() {
        ledger.openOccurrence("c-1", "alice");
        ledger.resolveMissed("c-1");
        ledger.openOccurrence("c-2", "alice");
        ledger.resolveMissed("c-2");
        ledger.openOccurrence("c-3", "bob");
        ledger.resolveMissed("c-3");

        assertThat(ledger.snapshot()).containsEntry("alice", 2).containsEntry("bob", 1);

        ledger.reset("alice");

        assertThat(ledger.count("alice")).isZero();
        assertThat(ledger.count("bob")).isEqualTo(1);
    }

    @Test
    void lastIncomingMarkerTracksUnresolvedCall() {
        ledger.openOccurrence("c-1", "alice");
        assertThat(ledger.lastIncomingFrom()).contains("alice");

        ledger.resolveWithoutMiss("c-1");
        assertThat(ledger.lastIncomingFrom()).isEmpty();
    }

    @Test
    void countsSurviveANewLedgerOverTheSameStore() {
        ledger.openOccurrence("c-1", "alice");
        ledger.resolveMissed("c-1");

        MissedCallLedger reopened = new MissedCallLedger(store, publisher, metrics, Clock.systemUTC());

        assertThat(reopened.count("alice")).isEqualTo(1);
    }
}
