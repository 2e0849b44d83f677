package com.phillippitts.peercall.service.session;

import com.phillippitts.peercall.service.loop.EventLoop;
import com.phillippitts.peercall.service.media.MediaCapture;
import com.phillippitts.peercall.service.media.MediaTransportFactory;
import com.phillippitts.peercall.service.signaling.SignalingChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates {@link PeerSession}s and binds them to signaling ownership on construction.
 *
 * <p>Tracks live sessions of both types so the call flow can treat the user as busy while any
 * session is up.
 */
public class PeerSessionFactory {

    private static final Logger LOG = LogManager.getLogger(PeerSessionFactory.class);

    private final SignalingChannel channel;
    private final EventLoop loop;
    private final SignalingOwnershipRegistry ownershipRegistry;
    private final MediaTransportFactory transportFactory;
    private final MediaCapture capture;
    private final Set<PeerSession> live = ConcurrentHashMap.newKeySet();

    public PeerSessionFactory(SignalingChannel channel,
                              EventLoop loop,
                              SignalingOwnershipRegistry ownershipRegistry,
                              MediaTransportFactory transportFactory,
                              MediaCapture capture) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.ownershipRegistry = Objects.requireNonNull(ownershipRegistry, "ownershipRegistry");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.capture = Objects.requireNonNull(capture, "capture");
    }

    /**
     * Creates a session and tries to bind it to the shared negotiation events. If another session
     * type already holds them the new session is returned unbound.
     */
    public PeerSession create(SessionType type, String partnerId, String roomId) {
        PeerSession session = new PeerSession(type, partnerId, roomId, channel, loop, transportFactory, capture);
        session.bindOwnership(ownershipRegistry.acquire(type, session));
        if (!session.ownsSignaling()) {
            LOG.warn("{} session with {} created without signaling ownership", type, partnerId);
        }
        live.add(session);
        session.onCleanup(() -> live.remove(session));
        return session;
    }

    public boolean hasLiveSession() {
        return !live.isEmpty();
    }

    public List<PeerSession> liveSessions() {
        return List.copyOf(live);
    }

    public SignalingOwnershipRegistry ownershipRegistry() {
        return ownershipRegistry;
    }
}
