package com.phillippitts.peercall.service.events;

import com.phillippitts.peercall.service.call.event.CallErrorEvent;
import com.phillippitts.peercall.service.identity.event.ReauthFailedEvent;
import com.phillippitts.peercall.service.ledger.event.MissedCallRecordedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized log output for user-facing call events. Throttled per key to avoid log spam when
 * the relay is flapping.
 */
@Component
class CallEventsListener {
    private static final Logger LOG = LogManager.getLogger(CallEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    CallEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onCallError(CallErrorEvent e) {
        if (shouldLog("call-error-" + e.kind())) {
            LOG.warn("Call error: kind={}, peer={}, message={}", e.kind(), e.peerId(), e.message());
        }
    }

    @EventListener
    void onReauthFailed(ReauthFailedEvent e) {
        if (shouldLog("reauth-failed")) {
            LOG.warn("Reauth failed for user {}: {}. Calls are refused until identity is reattached.",
                    e.userId(), e.error());
        }
    }

    @EventListener
    void onMissedCall(MissedCallRecordedEvent e) {
        LOG.info("Missed call from {} (total {})", e.peerId(), e.count());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
