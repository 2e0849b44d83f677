package com.phillippitts.peercall.service.call;

import com.phillippitts.peercall.config.properties.CallProperties;
import com.phillippitts.peercall.exception.CallControlException;
import com.phillippitts.peercall.exception.ErrorKind;
import com.phillippitts.peercall.exception.PeerCallException;
import com.phillippitts.peercall.service.call.event.CallErrorEvent;
import com.phillippitts.peercall.service.call.event.CallStateChangedEvent;
import com.phillippitts.peercall.service.call.event.IncomingCallEvent;
import com.phillippitts.peercall.service.call.event.RemoteDisconnectedEvent;
import com.phillippitts.peercall.service.call.event.RemoteReconnectedEvent;
import com.phillippitts.peercall.service.continuity.ActiveCallRegistry;
import com.phillippitts.peercall.service.continuity.CallControls;
import com.phillippitts.peercall.service.continuity.ContinuityBridge;
import com.phillippitts.peercall.service.identity.IdentityReattachment;
import com.phillippitts.peercall.service.ledger.MissedCallLedger;
import com.phillippitts.peercall.service.loop.EventLoop;
import com.phillippitts.peercall.service.loop.ScheduledTask;
import com.phillippitts.peercall.service.media.TransportState;
import com.phillippitts.peercall.service.metrics.CallMetrics;
import com.phillippitts.peercall.service.race.RaceGuard;
import com.phillippitts.peercall.service.session.NegotiationHandler;
import com.phillippitts.peercall.service.session.PeerSession;
import com.phillippitts.peercall.service.session.PeerSessionFactory;
import com.phillippitts.peercall.service.session.SessionType;
import com.phillippitts.peercall.service.session.SignalingOwnership;
import com.phillippitts.peercall.service.signaling.SignalingChannel;
import com.phillippitts.peercall.service.signaling.SignalingEvents;
import com.phillippitts.peercall.service.signaling.Subscription;
import com.phillippitts.peercall.service.signaling.message.CallAccepted;
import com.phillippitts.peercall.service.signaling.message.CallBusy;
import com.phillippitts.peercall.service.signaling.message.CallCanceled;
import com.phillippitts.peercall.service.signaling.message.CallDeclined;
import com.phillippitts.peercall.service.signaling.message.CallEnd;
import com.phillippitts.peercall.service.signaling.message.CallIncoming;
import com.phillippitts.peercall.service.signaling.message.CallInitiateAck;
import com.phillippitts.peercall.service.signaling.message.CallInitiateRequest;
import com.phillippitts.peercall.service.signaling.message.CallRef;
import com.phillippitts.peercall.service.signaling.message.CallRoomFull;
import com.phillippitts.peercall.service.signaling.message.CallTimedOut;
import com.phillippitts.peercall.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The direct-call state machine.
 *
 * <p>Processes UI intents and inbound {@code call:*} events on the event loop, drives outbound
 * call control, and owns at most one DIRECT {@link PeerSession}. See {@link CallState} for the
 * transitions.
 *
 * <p><b>Race handling:</b> canceled and timed-out call ids go to the {@link RaceGuard}, so an
 * {@code call:incoming} that arrives after its own cancel never rings. Events for a call id other
 * than the current one are ignored, except cancel and timeout, which still mark the guard.
 *
 * <p><b>Missed calls:</b> only the callee side counts. Each ringing incoming call opens one
 * ledger marker; remote cancel, relay timeout and the local ringing fallback all try to consume
 * it, and only the first one counts.
 *
 * <p><b>Threading:</b> all state is confined to the loop. Public intents may be called from any
 * thread; they return futures completed on the loop.
 *
 * @since 1.0
 */
public class CallSessionManager {

    private static final Logger LOG = LogManager.getLogger(CallSessionManager.class);

    static final String CALL_ID_KEY = "callId";

    private final SignalingChannel channel;
    private final EventLoop loop;
    private final RaceGuard raceGuard;
    private final MissedCallLedger ledger;
    private final IdentityReattachment identity;
    private final PeerSessionFactory sessions;
    private final ActiveCallRegistry activeCalls;
    private final ContinuityBridge continuity;
    private final NavigationHook navigation;
    private final ApplicationEventPublisher publisher;
    private final CallMetrics metrics;
    private final CallProperties props;
    private final List<Subscription> subscriptions;

    // Loop-confined; volatile for readers on REST threads
    private volatile CallRecord record;
    private volatile PeerSession session;
    private CompletableFuture<CallRecord> pendingInitiate;
    private ScheduledTask ringTimer = ScheduledTask.NONE;
    private ScheduledTask negotiationTimer = ScheduledTask.NONE;
    private Subscription activeRegistration = Subscription.NONE;
    private boolean remoteDisconnected;
    private long outgoingAttempt;

    public CallSessionManager(SignalingChannel channel,
                              EventLoop loop,
                              RaceGuard raceGuard,
                              MissedCallLedger ledger,
                              IdentityReattachment identity,
                              PeerSessionFactory sessions,
                              ActiveCallRegistry activeCalls,
                              ContinuityBridge continuity,
                              NavigationHook navigation,
                              ApplicationEventPublisher publisher,
                              CallMetrics metrics,
                              CallProperties props) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.raceGuard = Objects.requireNonNull(raceGuard, "raceGuard");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.activeCalls = Objects.requireNonNull(activeCalls, "activeCalls");
        this.continuity = Objects.requireNonNull(continuity, "continuity");
        this.navigation = Objects.requireNonNull(navigation, "navigation");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.props = Objects.requireNonNull(props, "props");
        this.subscriptions = List.of(
                channel.on(SignalingEvents.CALL_INCOMING, this::onIncoming),
                channel.on(SignalingEvents.CALL_ACCEPTED, this::onAccepted),
                channel.on(SignalingEvents.CALL_DECLINED, this::onDeclined),
                channel.on(SignalingEvents.CALL_TIMEOUT, this::onRemoteTimeout),
                channel.on(SignalingEvents.CALL_CANCELED, this::onRemoteCancel),
                channel.on(SignalingEvents.CALL_BUSY, this::onBusy),
                channel.on(SignalingEvents.CALL_ROOM_FULL, this::onRoomFull),
                channel.on(SignalingEvents.CALL_ENDED, this::onEnded));
    }

    // =======================================================================================
    // Queries
    // =======================================================================================

    public CallState state() {
        CallRecord current = record;
        return current == null ? CallState.IDLE : current.state();
    }

    public Optional<CallRecord> currentRecord() {
        return Optional.ofNullable(record);
    }

    public Optional<PeerSession> peerSession() {
        return Optional.ofNullable(session);
    }

    /**
     * Binds the shared negotiation events to {@code handler} for the given session type, unless
     * another type holds them.
     */
    public Optional<SignalingOwnership> acquireSignalingOwnership(SessionType type, NegotiationHandler handler) {
        return sessions.ownershipRegistry().acquire(type, handler);
    }

    // =======================================================================================
    // Intents
    // =======================================================================================

    /**
     * Places a call.
     *
     * @return future completed with the RINGING_OUT record once the relay issued a call id;
     *         fails with {@link CallControlException} or
     *         {@link com.phillippitts.peercall.exception.SignalingException}
     */
    public CompletableFuture<CallRecord> initiateCall(String peerId) {
        Objects.requireNonNull(peerId, "peerId");
        return onLoop(() -> {
            if (!identity.isTrusted()) {
                return refuse(ErrorKind.NOT_AUTHENTICATED, "Identity not reattached (" + identity.trustState() + ")", peerId);
            }
            if (record != null || sessions.hasLiveSession()) {
                return refuse(ErrorKind.INVALID_STATE, "Already in a call (" + state() + ")", peerId);
            }
            CallRecord dialing = CallRecord.outgoing(peerId, loop.clock().instant());
            CompletableFuture<CallRecord> result = new CompletableFuture<>();
            pendingInitiate = result;
            long attempt = ++outgoingAttempt;
            transition(dialing, "initiate");
            // Bounds DIALING too: a slow ack is abandoned once the ringing budget is spent.
            ringTimer = loop.schedule(() -> onOutgoingTimeout(attempt), props.outgoingTimeout());

            channel.request(SignalingEvents.CALL_INITIATE, new CallInitiateRequest(peerId))
                    .whenCompleteAsync((ack, err) -> onInitiateResult(dialing, result, ack, err), loop);
            return result;
        });
    }

    /** Cancels an outgoing call that has not been answered. */
    public CompletableFuture<Void> cancelCall() {
        return onLoop(() -> {
            CallRecord current = record;
            if (current == null || !current.isOutgoing()
                    || (current.state() != CallState.DIALING && current.state() != CallState.RINGING_OUT)) {
                return refuse(ErrorKind.INVALID_STATE, "No outgoing call to cancel (" + state() + ")",
                        current == null ? null : current.peerId());
            }
            withCallContext(current.callId(), () -> {
                if (current.callId() != null) {
                    raceGuard.markCanceled(current.callId());
                    channel.send(SignalingEvents.CALL_CANCEL, new CallRef(current.callId()));
                }
                failPendingInitiate(new CallControlException(ErrorKind.INVALID_STATE, "Call canceled", current.peerId()));
                toIdle("canceled");
            });
            return CompletableFuture.completedFuture(null);
        });
    }

    /** Accepts the ringing incoming call. */
    public CompletableFuture<CallRecord> acceptCall() {
        return onLoop(() -> {
            CallRecord current = record;
            if (current == null || current.state() != CallState.RINGING_IN) {
                return refuse(ErrorKind.INVALID_STATE, "No incoming call to accept (" + state() + ")",
                        current == null ? null : current.peerId());
            }
            return computeInCallContext(current.callId(), () -> {
                ringTimer.cancel();
                ledger.resolveWithoutMiss(current.callId());
                ledger.reset(current.peerId());
                channel.send(SignalingEvents.CALL_ACCEPT, new CallRef(current.callId()));
                CallRecord negotiating = current.withRoomId(roomIdFor(current.peerId())).withState(CallState.NEGOTIATING);
                transition(negotiating, "accepted");
                startNegotiation(negotiating, false);
                return CompletableFuture.completedFuture(negotiating);
            });
        });
    }

    /** Declines the ringing incoming call. Never counts as missed. */
    public CompletableFuture<Void> declineCall() {
        return onLoop(() -> {
            CallRecord current = record;
            if (current == null || current.state() != CallState.RINGING_IN) {
                return refuse(ErrorKind.INVALID_STATE, "No incoming call to decline (" + state() + ")",
                        current == null ? null : current.peerId());
            }
            withCallContext(current.callId(), () -> {
                ledger.resolveWithoutMiss(current.callId());
                raceGuard.markCanceled(current.callId());
                channel.send(SignalingEvents.CALL_DECLINE, new CallRef(current.callId()));
                toIdle("declined_locally");
            });
            return CompletableFuture.completedFuture(null);
        });
    }

    /**
     * Ends the call from any state: cancels while ringing out, declines while ringing in, hangs
     * up otherwise. A no-op in IDLE and ENDING.
     */
    public CompletableFuture<Void> hangup() {
        return onLoop(() -> {
            CallRecord current = record;
            if (current == null || current.state() == CallState.ENDING) {
                return CompletableFuture.completedFuture(null);
            }
            switch (current.state()) {
                case DIALING, RINGING_OUT -> {
                    return cancelCall();
                }
                case RINGING_IN -> {
                    return declineCall();
                }
                default -> {
                    withCallContext(current.callId(), () -> endCall(current, "hangup", true));
                    return CompletableFuture.completedFuture(null);
                }
            }
        });
    }

    public CompletableFuture<Boolean> toggleMic() {
        return withSession(s -> CompletableFuture.completedFuture(s.toggleMic()));
    }

    public CompletableFuture<Boolean> toggleCamera() {
        return withSession(PeerSession::toggleCamera);
    }

    public CompletableFuture<Boolean> toggleRemoteAudio() {
        return withSession(s -> CompletableFuture.completedFuture(s.toggleRemoteAudio()));
    }

    /** Unsubscribes from the channel and ends any call. */
    public void shutdown() {
        subscriptions.forEach(Subscription::cancel);
        loop.execute(() -> {
            CallRecord current = record;
            if (current != null && current.state().hasMedia()) {
                endCall(current, "shutdown", true);
            } else if (current != null) {
                if (current.state() == CallState.RINGING_IN) {
                    ledger.resolveWithoutMiss(current.callId());
                }
                toIdle("shutdown");
            }
        });
    }

    // =======================================================================================
    // Outgoing flow
    // =======================================================================================

    private void onInitiateResult(CallRecord dialing, CompletableFuture<CallRecord> result,
                                  CallInitiateAck ack, Throwable err) {
        if (pendingInitiate == result) {
            pendingInitiate = null;
        }
        boolean stillDialing = record == dialing;
        if (!stillDialing) {
            // Canceled or timed out while the ack was in flight.
            if (ack != null && ack.ok() && ack.callId() != null) {
                withCallContext(ack.callId(), () -> {
                    LOG.info("Late initiate ack for abandoned call; canceling {}", ack.callId());
                    raceGuard.markCanceled(ack.callId());
                    channel.send(SignalingEvents.CALL_CANCEL, new CallRef(ack.callId()));
                });
            }
            result.completeExceptionally(new CallControlException(ErrorKind.INVALID_STATE,
                    "Call abandoned before the relay answered", dialing.peerId()));
            return;
        }
        if (err != null) {
            Throwable cause = unwrap(err);
            PeerCallException failure = cause instanceof PeerCallException pce ? pce
                    : new CallControlException(ErrorKind.CALL_INITIATE_FAILED, "call:initiate failed", dialing.peerId(), cause);
            LOG.warn("call:initiate to {} failed: {}", dialing.peerId(), failure.getMessage());
            surface(failure.getKind(), failure.getMessage(), dialing.peerId());
            toIdle("initiate_failed");
            result.completeExceptionally(failure);
            return;
        }
        if (!ack.ok() || ack.callId() == null) {
            String remote = ack.error() == null ? "rejected" : ack.error();
            ErrorKind kind = isBusyError(remote) ? ErrorKind.ROOM_FULL : ErrorKind.CALL_INITIATE_FAILED;
            LOG.warn("call:initiate to {} rejected: {}", dialing.peerId(), LogSanitizer.truncate(remote, 120));
            surface(kind, remote, dialing.peerId());
            toIdle(kind == ErrorKind.ROOM_FULL ? "busy" : "initiate_failed");
            result.completeExceptionally(new CallControlException(kind, remote, dialing.peerId(), remote));
            return;
        }
        withCallContext(ack.callId(), () -> {
            CallRecord ringing = dialing.withCallId(ack.callId()).withState(CallState.RINGING_OUT);
            transition(ringing, "ringing");
            result.complete(ringing);
        });
    }

    private void onOutgoingTimeout(long attempt) {
        CallRecord current = record;
        if (current == null || !current.isOutgoing() || attempt != outgoingAttempt
                || (current.state() != CallState.DIALING && current.state() != CallState.RINGING_OUT)) {
            return;
        }
        withCallContext(current.callId(), () -> {
            LOG.info("Outgoing call to {} unanswered after {} ms", current.peerId(), props.getOutgoingTimeoutMs());
            if (current.callId() != null) {
                raceGuard.markTimedOut(current.callId());
                channel.send(SignalingEvents.CALL_CANCEL, new CallRef(current.callId()));
            }
            failPendingInitiate(new CallControlException(ErrorKind.INVALID_STATE, "Call timed out", current.peerId()));
            toIdle("timeout");
        });
    }

    private void onAccepted(CallAccepted event) {
        withCallContext(event.callId(), () -> {
            CallRecord current = record;
            if (current == null || current.state() != CallState.RINGING_OUT || !current.matches(event.callId())) {
                ignoreStale("call:accepted", event.callId());
                return;
            }
            ringTimer.cancel();
            String roomId = event.roomId() != null ? event.roomId() : roomIdFor(current.peerId());
            CallRecord negotiating = current.withRoomId(roomId).withState(CallState.NEGOTIATING);
            transition(negotiating, "accepted");
            startNegotiation(negotiating, true);
        });
    }

    private void onDeclined(CallDeclined event) {
        withCallContext(event.callId(), () -> {
            CallRecord current = record;
            if (current == null || !current.isOutgoing() || !current.matches(event.callId())
                    || current.state() != CallState.RINGING_OUT) {
                ignoreStale("call:declined", event.callId());
                return;
            }
            // Caller side never counts a miss.
            LOG.info("Call {} declined by {}", event.callId(), current.peerId());
            toIdle("declined");
        });
    }

    private void onBusy(CallBusy event) {
        rejectOutgoing(event.from(), "busy", "call:busy");
    }

    private void onRoomFull(CallRoomFull event) {
        rejectOutgoing(event.userId(), "room_full", "call:room_full");
    }

    private void rejectOutgoing(String from, String reason, String eventName) {
        CallRecord current = record;
        if (current == null || !current.isOutgoing()
                || (current.state() != CallState.DIALING && current.state() != CallState.RINGING_OUT)
                || (from != null && !from.equals(current.peerId()))) {
            LOG.debug("{} from {} ignored in {}", eventName, from, state());
            return;
        }
        withCallContext(current.callId(), () -> {
            LOG.info("{} is {}", current.peerId(), reason);
            if (current.callId() != null) {
                raceGuard.markCanceled(current.callId());
            }
            surface(ErrorKind.ROOM_FULL, reason, current.peerId());
            failPendingInitiate(new CallControlException(ErrorKind.ROOM_FULL, reason, current.peerId(), reason));
            toIdle(reason);
        });
    }

    // =======================================================================================
    // Incoming flow
    // =======================================================================================

    private void onIncoming(CallIncoming event) {
        withCallContext(event.callId(), () -> {
            if (event.callId() == null || event.from() == null) {
                LOG.warn("call:incoming without callId/from dropped");
                return;
            }
            if (raceGuard.isSuppressed(event.callId())) {
                suppress("call:incoming", "race_guard", event.callId());
                return;
            }
            if (record != null || sessions.hasLiveSession()) {
                suppress("call:incoming", "busy", event.callId());
                return;
            }
            if (navigation.screenPresence() == ScreenPresence.ON_CALL_SCREEN) {
                suppress("call:incoming", "on_call_screen", event.callId());
                return;
            }
            CallRecord ringing = CallRecord.incoming(event.callId(), event.from(), event.fromNick(), loop.clock().instant());
            ledger.openOccurrence(event.callId(), event.from());
            transition(ringing, "incoming");
            ringTimer = loop.schedule(() -> onIncomingFallback(event.callId()), props.incomingTimeout());
            publisher.publishEvent(new IncomingCallEvent(ringing));
        });
    }

    private void onRemoteCancel(CallCanceled event) {
        withCallContext(event.callId(), () -> {
            raceGuard.markCanceled(event.callId());
            CallRecord current = record;
            if (current == null || current.state() != CallState.RINGING_IN || !current.matches(event.callId())) {
                ignoreStale("call:cancel", event.callId());
                return;
            }
            ledger.resolveMissed(event.callId());
            toIdle("canceled_by_caller");
        });
    }

    private void onRemoteTimeout(CallTimedOut event) {
        withCallContext(event.callId(), () -> {
            raceGuard.markTimedOut(event.callId());
            CallRecord current = record;
            if (current == null || !current.matches(event.callId())) {
                ignoreStale("call:timeout", event.callId());
                return;
            }
            if (current.state() == CallState.RINGING_IN) {
                ledger.resolveMissed(event.callId());
                toIdle("timeout");
            } else if (current.state() == CallState.RINGING_OUT) {
                toIdle("timeout");
            } else {
                LOG.debug("call:timeout for {} ignored in {}", event.callId(), current.state());
            }
        });
    }

    private void onIncomingFallback(String callId) {
        withCallContext(callId, () -> {
            CallRecord current = record;
            if (current == null || current.state() != CallState.RINGING_IN || !current.matches(callId)) {
                return;
            }
            if (raceGuard.isSuppressed(callId)) {
                LOG.debug("Ringing fallback for {} found it already resolved", callId);
            } else {
                raceGuard.markTimedOut(callId);
            }
            LOG.info("Incoming call {} unanswered after {} ms", callId, props.getIncomingTimeoutMs());
            ledger.resolveMissed(callId);
            toIdle("timeout");
        });
    }

    // =======================================================================================
    // Negotiation and active call
    // =======================================================================================

    private void startNegotiation(CallRecord negotiating, boolean caller) {
        PeerSession created = sessions.create(SessionType.DIRECT, negotiating.peerId(), negotiating.roomId());
        session = created;
        remoteDisconnected = false;
        created.onTransportState(state -> onTransportState(created, state));
        negotiationTimer = loop.schedule(() -> onNegotiationTimeout(created), props.negotiationTimeout());

        CompletableFuture<?> media = created.openLocalStream(true);
        if (caller) {
            media = media.thenCompose(stream -> created.createOffer());
        }
        media.whenCompleteAsync((ignored, err) -> {
            if (err != null && session == created && !created.isClosed()) {
                LOG.warn("Negotiation with {} failed: {}", negotiating.peerId(), unwrap(err).getMessage());
                CallRecord current = record;
                if (current != null && current.state().hasMedia()) {
                    withCallContext(current.callId(), () -> endCall(current, "negotiation_failed", true));
                }
            }
        }, loop);
    }

    private void onTransportState(PeerSession source, TransportState state) {
        CallRecord current = record;
        if (source != session || current == null) {
            return;
        }
        withCallContext(current.callId(), () -> {
            switch (state) {
                case CONNECTED -> {
                    if (current.state() == CallState.NEGOTIATING) {
                        becomeActive(current);
                    } else if (current.state() == CallState.ACTIVE && remoteDisconnected) {
                        remoteDisconnected = false;
                        LOG.info("Media to {} recovered", current.peerId());
                        publisher.publishEvent(new RemoteReconnectedEvent(current.callId(), current.peerId(), loop.clock().instant()));
                    }
                }
                case DISCONNECTED, FAILED -> {
                    if (current.state() == CallState.ACTIVE && !remoteDisconnected) {
                        remoteDisconnected = true;
                        LOG.warn("Media to {} dropped ({})", current.peerId(), state);
                        publisher.publishEvent(new RemoteDisconnectedEvent(current.callId(), current.peerId(), loop.clock().instant()));
                    } else if (current.state() == CallState.NEGOTIATING && state == TransportState.FAILED) {
                        endCall(current, "transport_failed", true);
                    }
                }
                default -> LOG.debug("Transport state {} in {}", state, current.state());
            }
        });
    }

    private void becomeActive(CallRecord negotiating) {
        negotiationTimer.cancel();
        CallRecord active = negotiating.withState(CallState.ACTIVE);
        ledger.reset(active.peerId());
        transition(active, "connected");
        activeRegistration = activeCalls.register(new DirectCallControls(active.callId()));
        navigation.onCallActive(active);
    }

    private void onNegotiationTimeout(PeerSession negotiatingSession) {
        CallRecord current = record;
        if (current == null || current.state() != CallState.NEGOTIATING || session != negotiatingSession) {
            return;
        }
        withCallContext(current.callId(), () -> {
            LOG.warn("Negotiation with {} did not connect within {} ms", current.peerId(), props.getNegotiationTimeoutMs());
            endCall(current, "negotiation_timeout", true);
        });
    }

    private void onEnded(CallEnd event) {
        withCallContext(event.callId(), () -> {
            CallRecord current = record;
            if (current == null) {
                ignoreStale("call:ended", event.callId());
                return;
            }
            boolean sameCall = current.matches(event.callId())
                    || (event.callId() == null && event.roomId() != null && event.roomId().equals(current.roomId()));
            if (!sameCall) {
                ignoreStale("call:ended", event.callId());
                return;
            }
            switch (current.state()) {
                case NEGOTIATING, ACTIVE -> endCall(current, "remote_ended", false);
                case RINGING_IN -> {
                    raceGuard.markCanceled(current.callId());
                    ledger.resolveMissed(current.callId());
                    toIdle("canceled_by_caller");
                }
                case DIALING, RINGING_OUT -> toIdle("remote_ended");
                default -> LOG.debug("call:ended ignored in {}", current.state());
            }
        });
    }

    private void endCall(CallRecord current, String reason, boolean notifyRemote) {
        if (current.state() == CallState.ENDING) {
            return;
        }
        transition(current.withState(CallState.ENDING), reason);
        if (notifyRemote) {
            channel.send(SignalingEvents.CALL_END, new CallEnd(current.callId(), current.roomId()));
        }
        continuity.exit();
        toIdle(reason);
    }

    // =======================================================================================
    // Transitions
    // =======================================================================================

    private void transition(CallRecord next, String reason) {
        CallState previous = state();
        record = next;
        metrics.recordTransition(previous.name(), next.state().name());
        LOG.info("Call {} {} -> {} ({}) peer={}", next.callId(), previous, next.state(), reason, next.peerId());
        publisher.publishEvent(new CallStateChangedEvent(previous, next.state(), next, reason, loop.clock().instant()));
    }

    private void toIdle(String reason) {
        CallRecord last = record;
        if (last == null) {
            return;
        }
        ringTimer.cancel();
        ringTimer = ScheduledTask.NONE;
        negotiationTimer.cancel();
        negotiationTimer = ScheduledTask.NONE;
        activeRegistration.cancel();
        activeRegistration = Subscription.NONE;
        remoteDisconnected = false;
        PeerSession ending = session;
        session = null;
        if (ending != null) {
            ending.cleanup();
        }
        CallRecord idle = last.withState(CallState.IDLE);
        record = null;
        metrics.recordTransition(last.state().name(), CallState.IDLE.name());
        LOG.info("Call {} {} -> IDLE ({}) peer={}", last.callId(), last.state(), reason, last.peerId());
        publisher.publishEvent(new CallStateChangedEvent(last.state(), CallState.IDLE, idle, reason, loop.clock().instant()));
        navigation.onCallIdle(idle);
    }

    // =======================================================================================
    // Helpers
    // =======================================================================================

    private String roomIdFor(String peerId) {
        String self = channel.sessionUserId()
                .or(identity::knownUserId)
                .or(channel::sessionId)
                .orElse("self");
        return self.compareTo(peerId) <= 0 ? "room_" + self + "_" + peerId : "room_" + peerId + "_" + self;
    }

    private static boolean isBusyError(String error) {
        String e = error.toLowerCase();
        return e.contains("busy") || e.contains("room_full") || e.contains("room full");
    }

    private <T> CompletableFuture<T> refuse(ErrorKind kind, String message, String peerId) {
        LOG.warn("Refused: {}", message);
        surface(kind, message, peerId);
        return CompletableFuture.failedFuture(new CallControlException(kind, message, peerId));
    }

    private void surface(ErrorKind kind, String message, String peerId) {
        metrics.incrementError(kind.name());
        publisher.publishEvent(new CallErrorEvent(kind, message, peerId, loop.clock().instant()));
    }

    private void failPendingInitiate(PeerCallException failure) {
        CompletableFuture<CallRecord> pending = pendingInitiate;
        pendingInitiate = null;
        if (pending != null) {
            pending.completeExceptionally(failure);
        }
    }

    private void suppress(String event, String reason, String callId) {
        LOG.debug("{} for {} dropped ({}: {})", event, callId, ErrorKind.SUPPRESSED_EVENT, reason);
        metrics.incrementSuppressed(event, reason);
    }

    private void ignoreStale(String event, String callId) {
        CallRecord current = record;
        LOG.debug("{} for {} ignored (current call {}, state {})", event, callId,
                current == null ? null : current.callId(), state());
        metrics.incrementSuppressed(event, "stale_call_id");
    }

    private <T> CompletableFuture<T> withSession(Function<PeerSession, CompletableFuture<T>> action) {
        return onLoop(() -> {
            PeerSession current = session;
            if (current == null || current.isClosed()) {
                return CompletableFuture.failedFuture(
                        new CallControlException(ErrorKind.INVALID_STATE, "No media session (" + state() + ")", null));
            }
            return action.apply(current);
        });
    }

    private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        loop.execute(() -> {
            try {
                action.get().whenComplete((value, err) -> {
                    if (err != null) {
                        result.completeExceptionally(unwrap(err));
                    } else {
                        result.complete(value);
                    }
                });
            } catch (RuntimeException e) {
                LOG.error("Call intent failed", e);
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private static void withCallContext(String callId, Runnable action) {
        computeInCallContext(callId, () -> {
            action.run();
            return null;
        });
    }

    private static <T> T computeInCallContext(String callId, Supplier<T> action) {
        String previous = ThreadContext.get(CALL_ID_KEY);
        if (callId != null) {
            ThreadContext.put(CALL_ID_KEY, callId);
        }
        try {
            return action.get();
        } finally {
            if (previous != null) {
                ThreadContext.put(CALL_ID_KEY, previous);
            } else {
                ThreadContext.remove(CALL_ID_KEY);
            }
        }
    }

    private static Throwable unwrap(Throwable err) {
        Throwable t = err;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** Registry view of the active direct call; every operation hops onto the loop. */
    private final class DirectCallControls implements CallControls {
        private final String callId;

        DirectCallControls(String callId) {
            this.callId = callId;
        }

        @Override
        public String key() {
            return callId;
        }

        @Override
        public CallRecord record() {
            CallRecord current = record;
            return current != null && current.matches(callId) ? current : null;
        }

        @Override
        public boolean isLive() {
            CallRecord current = record;
            return current != null && current.matches(callId) && current.state() == CallState.ACTIVE;
        }

        @Override
        public CompletableFuture<Boolean> toggleMic() {
            return CallSessionManager.this.toggleMic();
        }

        @Override
        public CompletableFuture<Boolean> toggleRemoteAudio() {
            return CallSessionManager.this.toggleRemoteAudio();
        }

        @Override
        public CompletableFuture<Void> hangup() {
            return isLive() ? CallSessionManager.this.hangup() : CompletableFuture.completedFuture(null);
        }
    }
}
