package com.phillippitts.peercall.service.continuity;

import com.phillippitts.peercall.service.call.CallRecord;
import com.phillippitts.peercall.service.call.CallState;
import com.phillippitts.peercall.service.call.NavigationHook;
import com.phillippitts.peercall.service.continuity.event.ContinuityStateEvent;
import com.phillippitts.peercall.service.signaling.SignalingChannel;
import com.phillippitts.peercall.service.signaling.SignalingEvents;
import com.phillippitts.peercall.service.signaling.message.PipState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Picture-in-picture continuity: keeps an active call controllable after the call screen is gone.
 *
 * <p>The bridge holds only the registry key of the call. Every control looks the call up in
 * {@link ActiveCallRegistry}; if it is gone the control does nothing and the bridge exits. The
 * bridge never owns the call, so tearing it down never ends the call.
 *
 * @since 1.0
 */
public class ContinuityBridge {

    private static final Logger LOG = LogManager.getLogger(ContinuityBridge.class);

    private final ActiveCallRegistry registry;
    private final SignalingChannel channel;
    private final NavigationHook navigation;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private String callKey;
    private PartnerMeta partner;
    // Room and peer of the bridged call, kept for the closing pip:state after the call is gone
    private CallRecord bridged;

    public ContinuityBridge(ActiveCallRegistry registry,
                            SignalingChannel channel,
                            NavigationHook navigation,
                            ApplicationEventPublisher publisher,
                            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.navigation = Objects.requireNonNull(navigation, "navigation");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        channel.on(SignalingEvents.PIP_STATE, this::onPartnerPipState);
    }

    /**
     * Enters picture-in-picture for the call registered under {@code key}.
     *
     * @return {@code false} if no active call is registered under the key
     */
    public synchronized boolean enter(PartnerMeta meta, String key) {
        Optional<CallControls> controls = registry.lookup(key);
        if (controls.isEmpty() || controls.get().record().state() != CallState.ACTIVE) {
            LOG.info("PiP refused: no active call under {}", key);
            return false;
        }
        if (key.equals(callKey)) {
            return true;
        }
        CallRecord record = controls.get().record();
        this.callKey = key;
        this.bridged = record;
        this.partner = meta != null ? meta : new PartnerMeta(record.peerId(), record.peerNick());
        sendPipState(true, record);
        LOG.info("Entered PiP for call {}", key);
        publisher.publishEvent(new ContinuityStateEvent(true, true, key, record.peerId(), clock.instant()));
        return true;
    }

    /** Navigates back to the call screen and exits. */
    public synchronized boolean returnToCall() {
        Optional<CallControls> controls = live();
        if (controls.isEmpty()) {
            return false;
        }
        navigation.returnToCall(controls.get().record());
        exit();
        return true;
    }

    /** @return future of the new mic state, empty if no live call */
    public CompletableFuture<Optional<Boolean>> toggleMic() {
        Optional<CallControls> controls = liveSynchronized();
        if (controls.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return controls.get().toggleMic().thenApply(Optional::of);
    }

    /** @return future of the new remote-audio state, empty if no live call */
    public CompletableFuture<Optional<Boolean>> toggleRemoteAudio() {
        Optional<CallControls> controls = liveSynchronized();
        if (controls.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return controls.get().toggleRemoteAudio().thenApply(Optional::of);
    }

    /** Hangs up the bridged call. Idempotent. */
    public CompletableFuture<Void> endCall() {
        Optional<CallControls> controls = liveSynchronized();
        if (controls.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        exit();
        return controls.get().hangup();
    }

    /** Leaves picture-in-picture. Idempotent. */
    public synchronized void exit() {
        if (callKey == null) {
            return;
        }
        String key = callKey;
        PartnerMeta meta = partner;
        CallRecord record = bridged;
        callKey = null;
        partner = null;
        bridged = null;
        sendPipState(false, record);
        LOG.info("Exited PiP for call {}", key);
        publisher.publishEvent(new ContinuityStateEvent(false, true, key,
                meta == null ? null : meta.peerId(), clock.instant()));
    }

    public synchronized boolean isActive() {
        return callKey != null;
    }

    public synchronized Optional<PartnerMeta> partner() {
        return Optional.ofNullable(partner);
    }

    public synchronized Optional<String> callKey() {
        return Optional.ofNullable(callKey);
    }

    private synchronized Optional<CallControls> liveSynchronized() {
        return live();
    }

    private Optional<CallControls> live() {
        if (callKey == null) {
            LOG.debug("PiP control ignored: bridge not active");
            return Optional.empty();
        }
        Optional<CallControls> controls = registry.lookup(callKey);
        if (controls.isEmpty()) {
            LOG.info("PiP call {} is gone; exiting bridge", callKey);
            exit();
        }
        return controls;
    }

    private void sendPipState(boolean inPiP, CallRecord record) {
        channel.send(SignalingEvents.PIP_STATE, new PipState(inPiP, record.roomId(), record.peerId(), null));
    }

    private void onPartnerPipState(PipState state) {
        LOG.debug("Partner {} PiP={}", state.from(), state.inPiP());
        publisher.publishEvent(new ContinuityStateEvent(state.inPiP(), false, null, state.from(), clock.instant()));
    }
}
