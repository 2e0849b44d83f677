package com.phillippitts.peercall.service.session;

import com.phillippitts.peercall.service.loop.EventLoop;
import com.phillippitts.peercall.service.media.IceCandidate;
import com.phillippitts.peercall.service.media.MediaCapture;
import com.phillippitts.peercall.service.media.MediaStream;
import com.phillippitts.peercall.service.media.MediaTrack;
import com.phillippitts.peercall.service.media.MediaTransport;
import com.phillippitts.peercall.service.media.MediaTransportFactory;
import com.phillippitts.peercall.service.media.SessionDescription;
import com.phillippitts.peercall.service.media.TransportState;
import com.phillippitts.peercall.service.signaling.SignalingChannel;
import com.phillippitts.peercall.service.signaling.SignalingEvents;
import com.phillippitts.peercall.service.signaling.Subscription;
import com.phillippitts.peercall.service.signaling.message.CameraToggle;
import com.phillippitts.peercall.service.signaling.message.DescriptionMessage;
import com.phillippitts.peercall.service.signaling.message.IceCandidateMessage;
import com.phillippitts.peercall.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One negotiated media transport to one remote party.
 *
 * <p>Owns the local stream and the transport; the remote stream belongs to the transport. The
 * transport is created lazily by the first negotiation step. Remote ICE candidates that arrive
 * before the transport has a remote description are buffered per sender and flushed once it
 * does.
 *
 * <p>While this session holds {@link SignalingOwnership} it answers inbound offers, applies
 * answers and adds candidates from its partner. A session constructed while another type holds
 * ownership negotiates only through explicit calls.
 *
 * <p><b>Threading:</b> state is confined to the event loop. Media callbacks and future
 * continuations hop onto the loop before touching it.
 *
 * <p>{@link #cleanup()} is idempotent and safe from any call site.
 *
 * @since 1.0
 */
public class PeerSession implements NegotiationHandler {

    private static final Logger LOG = LogManager.getLogger(PeerSession.class);

    private final SessionType type;
    private final String partnerId;
    private final String roomId;
    private final SignalingChannel channel;
    private final EventLoop loop;
    private final MediaTransportFactory transportFactory;
    private final MediaCapture capture;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final List<Consumer<MediaStream>> remoteTrackListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<TransportState>> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Boolean>> remoteCameraListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> cleanupListeners = new CopyOnWriteArrayList<>();
    private final Map<String, List<IceCandidate>> pendingCandidates = new LinkedHashMap<>();
    private final Subscription camToggleSubscription;

    private SignalingOwnership ownership;
    private MediaTransport transport;
    private MediaStream localStream;
    private MediaStream remoteStream;
    private CompletableFuture<Void> localReady = CompletableFuture.completedFuture(null);

    private volatile boolean micEnabled = true;
    private volatile boolean cameraEnabled = true;
    private volatile boolean remoteAudioEnabled = true;
    private volatile boolean remoteCameraEnabled = true;

    PeerSession(SessionType type,
                String partnerId,
                String roomId,
                SignalingChannel channel,
                EventLoop loop,
                MediaTransportFactory transportFactory,
                MediaCapture capture) {
        this.type = Objects.requireNonNull(type, "type");
        this.partnerId = Objects.requireNonNull(partnerId, "partnerId");
        this.roomId = roomId;
        this.channel = Objects.requireNonNull(channel, "channel");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.capture = Objects.requireNonNull(capture, "capture");
        this.camToggleSubscription = channel.on(SignalingEvents.CAM_TOGGLE, this::onCameraToggle);
    }

    void bindOwnership(Optional<SignalingOwnership> token) {
        this.ownership = token.orElse(null);
    }

    // ---------------------------------------------------------------------------------------
    // Media
    // ---------------------------------------------------------------------------------------

    /**
     * Captures the local stream through the host's {@link MediaCapture} and attaches it.
     */
    public CompletableFuture<MediaStream> openLocalStream(boolean withVideo) {
        if (closed.get()) {
            return closedFuture();
        }
        CompletableFuture<MediaStream> captured;
        try {
            captured = capture.openLocalStream(withVideo);
        } catch (RuntimeException e) {
            LOG.warn("Local capture for {} failed: {}", partnerId, e.getMessage());
            captured = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<MediaStream> opened = captured
                .thenApplyAsync(stream -> {
                    if (closed.get()) {
                        stream.tracks().forEach(MediaTrack::stop);
                        throw closedException();
                    }
                    attachLocalStream(stream);
                    return stream;
                }, loop);
        localReady = opened.thenApply(s -> null);
        return opened;
    }

    public void attachLocalStream(MediaStream stream) {
        Objects.requireNonNull(stream, "stream");
        if (closed.get()) {
            LOG.debug("attachLocalStream after cleanup ignored");
            return;
        }
        this.localStream = stream;
        stream.audioTracks().forEach(t -> t.setEnabled(micEnabled));
        stream.videoTrack().ifPresent(t -> t.setEnabled(cameraEnabled));
        if (transport != null) {
            stream.tracks().forEach(t -> transport.addTrack(t, stream));
        }
    }

    // ---------------------------------------------------------------------------------------
    // Negotiation
    // ---------------------------------------------------------------------------------------

    /** Creates and applies a local offer, then sends it to the partner. */
    public CompletableFuture<SessionDescription> createOffer() {
        if (closed.get()) {
            return closedFuture();
        }
        return localReady.thenComposeAsync(ignored -> {
            MediaTransport t = ensureTransport();
            return t.createOffer()
                    .thenCompose(offer -> t.setLocalDescription(offer).thenApply(v -> offer));
        }, loop).thenApplyAsync(offer -> {
            LOG.debug("Sending offer to {} ({})", partnerId, LogSanitizer.describeSdp(offer.sdp()));
            channel.send(SignalingEvents.OFFER, DescriptionMessage.outbound(partnerId, offer));
            return offer;
        }, loop);
    }

    /** Creates and applies a local answer to the applied remote offer, then sends it. */
    public CompletableFuture<SessionDescription> createAnswer() {
        if (closed.get()) {
            return closedFuture();
        }
        return localReady.thenComposeAsync(ignored -> {
            MediaTransport t = ensureTransport();
            return t.createAnswer()
                    .thenCompose(answer -> t.setLocalDescription(answer).thenApply(v -> answer));
        }, loop).thenApplyAsync(answer -> {
            LOG.debug("Sending answer to {} ({})", partnerId, LogSanitizer.describeSdp(answer.sdp()));
            channel.send(SignalingEvents.ANSWER, DescriptionMessage.outbound(partnerId, answer));
            return answer;
        }, loop);
    }

    public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
        Objects.requireNonNull(description, "description");
        if (closed.get()) {
            return closedFuture();
        }
        return localReady.thenComposeAsync(ignored -> ensureTransport().setRemoteDescription(description), loop)
                .thenRunAsync(this::flushPendingCandidates, loop);
    }

    /**
     * Adds a remote candidate, or buffers it under {@code fromId} until the transport is ready.
     */
    public void addRemoteIceCandidate(String fromId, IceCandidate candidate) {
        if (closed.get() || candidate == null) {
            return;
        }
        String key = fromId == null ? partnerId : fromId;
        if (transport == null || !transport.hasRemoteDescription()) {
            pendingCandidates.computeIfAbsent(key, k -> new ArrayList<>()).add(candidate);
            LOG.debug("Buffered ICE candidate from {} ({} pending)", key, pendingCandidates.get(key).size());
            return;
        }
        addCandidate(candidate);
    }

    public int pendingCandidateCount(String fromId) {
        List<IceCandidate> list = pendingCandidates.get(fromId);
        return list == null ? 0 : list.size();
    }

    private void flushPendingCandidates() {
        if (closed.get() || transport == null) {
            return;
        }
        List<IceCandidate> ready = pendingCandidates.remove(partnerId);
        if (!pendingCandidates.isEmpty()) {
            LOG.debug("Discarding candidates from non-partner senders {}", pendingCandidates.keySet());
            pendingCandidates.clear();
        }
        if (ready == null) {
            return;
        }
        LOG.debug("Flushing {} buffered ICE candidate(s) from {}", ready.size(), partnerId);
        ready.forEach(this::addCandidate);
    }

    private void addCandidate(IceCandidate candidate) {
        transport.addIceCandidate(candidate).whenComplete((v, err) -> {
            if (err != null) {
                LOG.warn("Failed to add ICE candidate from {}: {}", partnerId, err.getMessage());
            }
        });
    }

    private MediaTransport ensureTransport() {
        if (closed.get()) {
            throw closedException();
        }
        if (transport != null) {
            return transport;
        }
        MediaTransport created = transportFactory.create(partnerId);
        created.setListener(new MediaTransport.Listener() {
            @Override
            public void onIceCandidate(IceCandidate candidate) {
                loop.execute(() -> {
                    if (!closed.get()) {
                        channel.send(SignalingEvents.ICE_CANDIDATE, IceCandidateMessage.outbound(partnerId, candidate));
                    }
                });
            }

            @Override
            public void onTrack(MediaTrack track, MediaStream stream) {
                loop.execute(() -> handleRemoteTrack(track, stream));
            }

            @Override
            public void onStateChange(TransportState state) {
                loop.execute(() -> handleStateChange(state));
            }
        });
        if (localStream != null) {
            localStream.tracks().forEach(t -> created.addTrack(t, localStream));
        }
        transport = created;
        LOG.info("Created {} media transport to {}", type, partnerId);
        return created;
    }

    // NegotiationHandler: only invoked while this session holds ownership

    @Override
    public void onOffer(DescriptionMessage message) {
        if (!fromPartner(message.from()) || message.description() == null) {
            return;
        }
        LOG.debug("Offer from {} ({})", partnerId, LogSanitizer.describeSdp(message.description().sdp()));
        setRemoteDescription(message.description())
                .thenCompose(v -> createAnswer())
                .whenComplete((answer, err) -> {
                    if (err != null) {
                        LOG.warn("Answering offer from {} failed: {}", partnerId, err.getMessage());
                    }
                });
    }

    @Override
    public void onAnswer(DescriptionMessage message) {
        if (!fromPartner(message.from()) || message.description() == null) {
            return;
        }
        setRemoteDescription(message.description()).whenComplete((v, err) -> {
            if (err != null) {
                LOG.warn("Applying answer from {} failed: {}", partnerId, err.getMessage());
            }
        });
    }

    @Override
    public void onIceCandidate(IceCandidateMessage message) {
        if (!fromPartner(message.from())) {
            return;
        }
        addRemoteIceCandidate(message.from(), message.candidate());
    }

    private boolean fromPartner(String from) {
        if (from != null && !from.equals(partnerId)) {
            LOG.debug("Ignoring negotiation message from {} (partner is {})", from, partnerId);
            return false;
        }
        return !closed.get();
    }

    // ---------------------------------------------------------------------------------------
    // Callbacks
    // ---------------------------------------------------------------------------------------

    public void onRemoteTrack(Consumer<MediaStream> listener) {
        remoteTrackListeners.add(Objects.requireNonNull(listener, "listener"));
        if (remoteStream != null) {
            listener.accept(remoteStream);
        }
    }

    public void onTransportState(Consumer<TransportState> listener) {
        stateListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void onRemoteCamera(Consumer<Boolean> listener) {
        remoteCameraListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    void onCleanup(Runnable listener) {
        cleanupListeners.add(listener);
    }

    private void handleRemoteTrack(MediaTrack track, MediaStream stream) {
        if (closed.get()) {
            return;
        }
        remoteStream = stream;
        if (track.kind() == MediaTrack.Kind.AUDIO) {
            track.setEnabled(remoteAudioEnabled);
        }
        LOG.debug("Remote {} track from {}", track.kind(), partnerId);
        remoteTrackListeners.forEach(l -> l.accept(stream));
    }

    private void handleStateChange(TransportState state) {
        if (closed.get()) {
            return;
        }
        LOG.info("Transport to {} is {}", partnerId, state);
        stateListeners.forEach(l -> l.accept(state));
    }

    private void onCameraToggle(CameraToggle toggle) {
        if (closed.get() || (toggle.from() != null && !toggle.from().equals(partnerId))) {
            return;
        }
        remoteCameraEnabled = toggle.enabled();
        LOG.debug("Partner {} turned camera {}", partnerId, toggle.enabled() ? "on" : "off");
        remoteCameraListeners.forEach(l -> l.accept(toggle.enabled()));
    }

    // ---------------------------------------------------------------------------------------
    // Toggles
    // ---------------------------------------------------------------------------------------

    /** @return the new microphone state */
    public boolean toggleMic() {
        if (closed.get()) {
            return micEnabled;
        }
        micEnabled = !micEnabled;
        if (localStream != null) {
            localStream.audioTracks().forEach(t -> t.setEnabled(micEnabled));
        }
        LOG.debug("Mic {}", micEnabled ? "on" : "off");
        return micEnabled;
    }

    /**
     * Turns the outgoing camera off or on by swapping the video sender's track in place. The
     * transport is not renegotiated; the partner learns the new state from {@code cam-toggle}.
     *
     * @return future of the new camera state
     */
    public CompletableFuture<Boolean> toggleCamera() {
        if (closed.get()) {
            return CompletableFuture.completedFuture(cameraEnabled);
        }
        boolean enable = !cameraEnabled;
        Optional<MediaTrack> current = localStream == null ? Optional.empty() : localStream.videoTrack();
        if (!enable) {
            cameraEnabled = false;
            current.ifPresent(t -> t.setEnabled(false));
            if (transport != null) {
                transport.replaceTrack(MediaTrack.Kind.VIDEO, null);
            }
            sendCameraState(false);
            return CompletableFuture.completedFuture(false);
        }
        if (current.isPresent() && current.get().isLive()) {
            MediaTrack track = current.get();
            track.setEnabled(true);
            if (transport != null) {
                transport.replaceTrack(MediaTrack.Kind.VIDEO, track);
            }
            cameraEnabled = true;
            sendCameraState(true);
            return CompletableFuture.completedFuture(true);
        }
        return capture.openVideoTrack().thenApplyAsync(track -> {
            if (closed.get()) {
                track.stop();
                return false;
            }
            if (localStream != null) {
                current.ifPresent(localStream::removeTrack);
                localStream.addTrack(track);
            }
            track.setEnabled(true);
            if (transport != null) {
                transport.replaceTrack(MediaTrack.Kind.VIDEO, track);
            }
            cameraEnabled = true;
            sendCameraState(true);
            return true;
        }, loop);
    }

    /** Mutes or unmutes the partner's audio locally. @return the new state */
    public boolean toggleRemoteAudio() {
        if (closed.get()) {
            return remoteAudioEnabled;
        }
        remoteAudioEnabled = !remoteAudioEnabled;
        if (remoteStream != null) {
            remoteStream.audioTracks().forEach(t -> t.setEnabled(remoteAudioEnabled));
        }
        return remoteAudioEnabled;
    }

    private void sendCameraState(boolean enabled) {
        channel.send(SignalingEvents.CAM_TOGGLE, new CameraToggle(roomId, enabled, partnerId, null));
    }

    // ---------------------------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------------------------

    /**
     * Stops local tracks, closes the transport, drops callbacks and releases signaling
     * ownership. Only the first invocation does anything.
     */
    public void cleanup() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Cleaning up {} session with {}", type, partnerId);
        camToggleSubscription.cancel();
        if (ownership != null) {
            ownership.release();
        }
        if (localStream != null) {
            localStream.tracks().forEach(MediaTrack::stop);
        }
        if (transport != null) {
            try {
                transport.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing media transport to {}", partnerId, e);
            }
        }
        pendingCandidates.clear();
        remoteTrackListeners.clear();
        stateListeners.clear();
        remoteCameraListeners.clear();
        cleanupListeners.forEach(Runnable::run);
        cleanupListeners.clear();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean ownsSignaling() {
        return ownership != null && !ownership.isReleased();
    }

    public SessionType type() {
        return type;
    }

    public String partnerId() {
        return partnerId;
    }

    public Optional<String> roomId() {
        return Optional.ofNullable(roomId);
    }

    public Optional<MediaTransport> transport() {
        return Optional.ofNullable(transport);
    }

    public TransportState transportState() {
        return transport == null ? TransportState.NEW : transport.state();
    }

    public Optional<MediaStream> localStream() {
        return Optional.ofNullable(localStream);
    }

    public Optional<MediaStream> remoteStream() {
        return Optional.ofNullable(remoteStream);
    }

    public boolean isMicEnabled() {
        return micEnabled;
    }

    public boolean isCameraEnabled() {
        return cameraEnabled;
    }

    public boolean isRemoteAudioEnabled() {
        return remoteAudioEnabled;
    }

    public boolean isRemoteCameraEnabled() {
        return remoteCameraEnabled;
    }

    private static IllegalStateException closedException() {
        return new IllegalStateException("PeerSession closed");
    }

    private static <T> CompletableFuture<T> closedFuture() {
        return CompletableFuture.failedFuture(closedException());
    }
}
