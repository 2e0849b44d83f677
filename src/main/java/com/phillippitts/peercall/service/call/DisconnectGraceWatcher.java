package com.phillippitts.peercall.service.call;

import com.phillippitts.peercall.service.call.event.CallStateChangedEvent;
import com.phillippitts.peercall.service.call.event.RemoteDisconnectedEvent;
import com.phillippitts.peercall.service.call.event.RemoteReconnectedEvent;
import com.phillippitts.peercall.service.loop.EventLoop;
import com.phillippitts.peercall.service.loop.ScheduledTask;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.util.Objects;

/**
 * Default grace policy for a dropped media connection: hang up if the transport has not come
 * back within the grace period.
 *
 * <p>Hosts that want a different policy replace this bean and call
 * {@link CallSessionManager#hangup()} themselves.
 */
public class DisconnectGraceWatcher {

    private static final Logger LOG = LogManager.getLogger(DisconnectGraceWatcher.class);

    private final CallSessionManager manager;
    private final EventLoop loop;
    private final Duration grace;

    private ScheduledTask pending = ScheduledTask.NONE;
    private String pendingCallId;

    public DisconnectGraceWatcher(CallSessionManager manager, EventLoop loop, Duration grace) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.grace = Objects.requireNonNull(grace, "grace");
    }

    @EventListener
    public synchronized void onRemoteDisconnected(RemoteDisconnectedEvent event) {
        pending.cancel();
        pendingCallId = event.callId();
        LOG.info("Waiting {} ms for media to {} to recover", grace.toMillis(), event.peerId());
        pending = loop.schedule(() -> expire(event.callId()), grace);
    }

    @EventListener
    public synchronized void onRemoteReconnected(RemoteReconnectedEvent event) {
        if (event.callId() != null && event.callId().equals(pendingCallId)) {
            LOG.info("Media to {} recovered within grace period", event.peerId());
            clear();
        }
    }

    @EventListener
    public synchronized void onCallStateChanged(CallStateChangedEvent event) {
        if (pendingCallId != null && event.current() != CallState.ACTIVE) {
            clear();
        }
    }

    public synchronized boolean isPending() {
        return pendingCallId != null;
    }

    private void expire(String callId) {
        synchronized (this) {
            if (!callId.equals(pendingCallId)) {
                return;
            }
            pendingCallId = null;
            pending = ScheduledTask.NONE;
        }
        boolean sameCall = manager.currentRecord().map(r -> r.matches(callId)).orElse(false);
        if (sameCall) {
            LOG.warn("Media to call {} did not recover; hanging up", callId);
            manager.hangup();
        }
    }

    private void clear() {
        pending.cancel();
        pending = ScheduledTask.NONE;
        pendingCallId = null;
    }
}
