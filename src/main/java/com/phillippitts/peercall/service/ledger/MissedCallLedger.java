package com.phillippitts.peercall.service.ledger;

import com.phillippitts.peercall.service.ledger.event.MissedCallRecordedEvent;
import com.phillippitts.peercall.service.metrics.CallMetrics;
import com.phillippitts.peercall.service.store.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-peer missed-call counters.
 *
 * <p>Several handlers may independently conclude that an incoming call was missed (remote
 * cancel, relay timeout, the local ringing fallback). Each incoming call opens exactly one
 * resolution marker; {@link #resolveMissed(String)} consumes it with a compare-and-remove, so
 * only the first caller increments.
 *
 * <p>Counters persist in the {@link KeyValueStore} as {@code {peerId: count}} under
 * {@value #COUNTS_KEY}. The last ringing peer is kept under {@value #LAST_INCOMING_KEY} until its
 * occurrence resolves.
 *
 * <p>Only the callee side ever increments. Callers never open markers for their own outgoing
 * calls.
 *
 * @since 1.0
 */
public class MissedCallLedger {

    private static final Logger LOG = LogManager.getLogger(MissedCallLedger.class);

    public static final String COUNTS_KEY = "missed_calls_by_user_v1";
    public static final String LAST_INCOMING_KEY = "last_incoming_from";

    private final KeyValueStore store;
    private final ApplicationEventPublisher publisher;
    private final CallMetrics metrics;
    private final Clock clock;

    /** callId -> peerId, one per unresolved incoming call. */
    private final Map<String, String> openOccurrences = new ConcurrentHashMap<>();
    private final Object countsLock = new Object();

    public MissedCallLedger(KeyValueStore store,
                            ApplicationEventPublisher publisher,
                            CallMetrics metrics,
                            Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens the resolution marker for an incoming call. Reopening an id that is already open is
     * a no-op.
     */
    public void openOccurrence(String callId, String peerId) {
        if (callId == null || peerId == null) {
            return;
        }
        if (openOccurrences.putIfAbsent(callId, peerId) == null) {
            store.put(LAST_INCOMING_KEY, peerId);
            LOG.debug("Opened missed-call marker for call {} from {}", callId, peerId);
        }
    }

    /**
     * Consumes the marker for {@code callId} and increments the peer's counter.
     *
     * @return {@code true} if this invocation recorded the miss; {@code false} if the occurrence
     *         was already resolved (or never opened)
     */
    public boolean resolveMissed(String callId) {
        if (callId == null) {
            return false;
        }
        String peerId = openOccurrences.remove(callId);
        if (peerId == null) {
            LOG.debug("Missed-call marker for {} already consumed", callId);
            return false;
        }
        clearLastIncoming(peerId);
        int count = increment(peerId);
        metrics.incrementMissed();
        LOG.info("Missed call {} from {} (count now {})", callId, peerId, count);
        publisher.publishEvent(new MissedCallRecordedEvent(peerId, callId, count, clock.instant()));
        return true;
    }

    /**
     * Consumes the marker without counting (accepted or locally declined).
     */
    public boolean resolveWithoutMiss(String callId) {
        if (callId == null) {
            return false;
        }
        String peerId = openOccurrences.remove(callId);
        if (peerId == null) {
            return false;
        }
        clearLastIncoming(peerId);
        return true;
    }

    public boolean isOpen(String callId) {
        return callId != null && openOccurrences.containsKey(callId);
    }

    public void reset(String peerId) {
        if (peerId == null) {
            return;
        }
        synchronized (countsLock) {
            JSONObject counts = readCounts();
            if (counts.has(peerId)) {
                counts.remove(peerId);
                store.put(COUNTS_KEY, counts.toString());
                LOG.debug("Missed-call counter reset for {}", peerId);
            }
        }
    }

    public int count(String peerId) {
        if (peerId == null) {
            return 0;
        }
        synchronized (countsLock) {
            return readCounts().optInt(peerId, 0);
        }
    }

    public Map<String, Integer> snapshot() {
        synchronized (countsLock) {
            JSONObject counts = readCounts();
            Map<String, Integer> copy = new LinkedHashMap<>();
            for (String key : counts.keySet()) {
                copy.put(key, counts.optInt(key, 0));
            }
            return Collections.unmodifiableMap(copy);
        }
    }

    public Optional<String> lastIncomingFrom() {
        return store.get(LAST_INCOMING_KEY);
    }

    private int increment(String peerId) {
        synchronized (countsLock) {
            JSONObject counts = readCounts();
            int next = counts.optInt(peerId, 0) + 1;
            counts.put(peerId, next);
            store.put(COUNTS_KEY, counts.toString());
            return next;
        }
    }

    private void clearLastIncoming(String peerId) {
        if (store.get(LAST_INCOMING_KEY).map(peerId::equals).orElse(false)) {
            store.remove(LAST_INCOMING_KEY);
        }
    }

    private JSONObject readCounts() {
        String raw = store.get(COUNTS_KEY).orElse(null);
        if (raw == null || raw.isBlank()) {
            return new JSONObject();
        }
        try {
            return new JSONObject(raw);
        } catch (JSONException e) {
            LOG.warn("Stored missed-call counters unreadable; starting over", e);
            return new JSONObject();
        }
    }
}
