package com.phillippitts.peercall.service.race;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived memory of canceled and timed-out call ids.
 *
 * <p>Decline, cancel and timeout can reach this client before the {@code call:incoming} they
 * refer to. Without this guard the UI would ring for a call the caller already abandoned, and
 * no later event would dismiss it.
 *
 * <p>Entries expire after the TTL. Eviction is lazy (each call sweeps expired entries); there is
 * no background timer. Null or blank ids are never marked and never suppressed.
 *
 * <p><b>Thread Safety:</b> safe for concurrent use.
 *
 * @since 1.0
 */
public class RaceGuard {

    private static final Logger LOG = LogManager.getLogger(RaceGuard.class);

    private final Clock clock;
    private final Duration ttl;
    private final Map<String, Instant> canceled = new ConcurrentHashMap<>();
    private final Map<String, Instant> timedOut = new ConcurrentHashMap<>();

    public RaceGuard(Clock clock, Duration ttl) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    public void markCanceled(String callId) {
        mark(canceled, callId, "canceled");
    }

    public void markTimedOut(String callId) {
        mark(timedOut, callId, "timed-out");
    }

    /**
     * @return {@code true} if the call id was canceled or timed out within the TTL
     */
    public boolean isSuppressed(String callId) {
        evictExpired();
        if (isBlank(callId)) {
            return false;
        }
        return canceled.containsKey(callId) || timedOut.containsKey(callId);
    }

    public boolean isCanceled(String callId) {
        evictExpired();
        return !isBlank(callId) && canceled.containsKey(callId);
    }

    public boolean isTimedOut(String callId) {
        evictExpired();
        return !isBlank(callId) && timedOut.containsKey(callId);
    }

    /** Number of live entries across both sets, after eviction. */
    public int size() {
        evictExpired();
        return canceled.size() + timedOut.size();
    }

    private void mark(Map<String, Instant> set, String callId, String label) {
        evictExpired();
        if (isBlank(callId)) {
            return;
        }
        set.put(callId, clock.instant());
        LOG.debug("Call {} marked {}", callId, label);
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        canceled.values().removeIf(at -> at.isBefore(cutoff));
        timedOut.values().removeIf(at -> at.isBefore(cutoff));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
