package com.phillippitts.peercall.service.continuity;

import com.phillippitts.peercall.service.signaling.Subscription;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service locator for live calls, owned by the application context.
 *
 * <p>The call flow registers a call's {@link CallControls} while it is active and removes them when
 * the call ends. Anything that must act on a call it does not own (picture-in-picture, REST)
 * looks the controls up by key at each use, so holding a key never keeps a call alive.
 *
 * <p><b>Thread Safety:</b> safe for concurrent use.
 */
public class ActiveCallRegistry {

    private static final Logger LOG = LogManager.getLogger(ActiveCallRegistry.class);

    private final Map<String, CallControls> calls = new ConcurrentHashMap<>();

    /**
     * @return subscription whose {@code cancel()} unregisters these controls (and nothing
     *         registered later under the same key)
     */
    public Subscription register(CallControls controls) {
        Objects.requireNonNull(controls, "controls");
        String key = controls.key();
        CallControls previous = calls.put(key, controls);
        if (previous != null && previous != controls) {
            LOG.warn("Replaced live call controls registered under {}", key);
        }
        LOG.debug("Registered call controls {}", key);
        return () -> {
            if (calls.remove(key, controls)) {
                LOG.debug("Unregistered call controls {}", key);
            }
        };
    }

    /** Live controls for the key; stale entries are dropped. */
    public Optional<CallControls> lookup(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CallControls controls = calls.get(key);
        if (controls == null) {
            return Optional.empty();
        }
        if (!controls.isLive()) {
            calls.remove(key, controls);
            return Optional.empty();
        }
        return Optional.of(controls);
    }

    /** Any live call; there is at most one in practice. */
    public Optional<CallControls> current() {
        return calls.keySet().stream()
                .map(this::lookup)
                .flatMap(Optional::stream)
                .findFirst();
    }

    public int size() {
        return calls.size();
    }
}
