package com.phillippitts.peercall.service.matchmaking;

import com.phillippitts.peercall.service.loop.EventLoop;
import com.phillippitts.peercall.service.matchmaking.event.MatchEndedEvent;
import com.phillippitts.peercall.service.matchmaking.event.MatchStartedEvent;
import com.phillippitts.peercall.service.session.PeerSession;
import com.phillippitts.peercall.service.session.PeerSessionFactory;
import com.phillippitts.peercall.service.session.SessionType;
import com.phillippitts.peercall.service.signaling.SignalingChannel;
import com.phillippitts.peercall.service.signaling.SignalingEvents;
import com.phillippitts.peercall.service.signaling.Subscription;
import com.phillippitts.peercall.service.signaling.message.Empty;
import com.phillippitts.peercall.service.signaling.message.MatchFound;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Anonymous matchmaking on top of {@link PeerSession}.
 *
 * <p>{@code start} queues this client on the relay; {@code match_found} creates a MATCHMAKING
 * session with the partner. The side whose relay connection id sorts lower creates the offer, the
 * other answers. {@code next} drops the partner and requeues; {@code stop} leaves the queue.
 *
 * <p>Matchmaking never creates call records and never touches the missed-call ledger.
 *
 * <p><b>Threading:</b> intents and inbound events run on the event loop.
 */
public class MatchmakingSession {

    private static final Logger LOG = LogManager.getLogger(MatchmakingSession.class);

    private final SignalingChannel channel;
    private final EventLoop loop;
    private final PeerSessionFactory sessions;
    private final ApplicationEventPublisher publisher;
    private final List<Subscription> subscriptions;

    private volatile MatchmakingState state = MatchmakingState.IDLE;
    private volatile PeerSession session;
    private String roomId;

    public MatchmakingSession(SignalingChannel channel,
                              EventLoop loop,
                              PeerSessionFactory sessions,
                              ApplicationEventPublisher publisher) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.subscriptions = List.of(
                channel.on(SignalingEvents.MATCH_FOUND, this::onMatchFound),
                channel.on(SignalingEvents.PEER_LEFT, e -> onPeerGone("peer_left")),
                channel.on(SignalingEvents.PEER_STOPPED, e -> onPeerGone("peer_stopped")));
    }

    public void start() {
        loop.execute(() -> {
            if (state != MatchmakingState.IDLE) {
                LOG.debug("Matchmaking already {}", state);
                return;
            }
            state = MatchmakingState.SEARCHING;
            LOG.info("Joining matchmaking queue");
            channel.send(SignalingEvents.MATCH_START, Empty.INSTANCE);
        });
    }

    /** Drops the current partner; the relay requeues this client. */
    public void next() {
        loop.execute(() -> {
            if (state == MatchmakingState.IDLE) {
                LOG.debug("next ignored: matchmaking not started");
                return;
            }
            teardown("next");
            state = MatchmakingState.SEARCHING;
            channel.send(SignalingEvents.MATCH_NEXT, Empty.INSTANCE);
        });
    }

    public void stop() {
        loop.execute(() -> {
            if (state == MatchmakingState.IDLE) {
                return;
            }
            teardown("stop");
            state = MatchmakingState.IDLE;
            LOG.info("Left matchmaking queue");
            channel.send(SignalingEvents.MATCH_STOP, Empty.INSTANCE);
        });
    }

    public MatchmakingState state() {
        return state;
    }

    public Optional<PeerSession> peerSession() {
        return Optional.ofNullable(session);
    }

    public void shutdown() {
        subscriptions.forEach(Subscription::cancel);
        stop();
    }

    private void onMatchFound(MatchFound match) {
        if (state != MatchmakingState.SEARCHING) {
            LOG.debug("match_found ignored in {}", state);
            return;
        }
        if (match.partnerConnectionId() == null) {
            LOG.warn("match_found without partner id dropped");
            return;
        }
        String self = channel.sessionId().orElse("");
        boolean offerer = self.compareTo(match.partnerConnectionId()) < 0;
        PeerSession created = sessions.create(SessionType.MATCHMAKING, match.partnerConnectionId(), match.roomId());
        session = created;
        roomId = match.roomId();
        state = MatchmakingState.MATCHED;
        LOG.info("Matched with {} in room {} (offerer={})", match.partnerConnectionId(), match.roomId(), offerer);
        publisher.publishEvent(new MatchStartedEvent(match.roomId(), match.partnerConnectionId(), offerer,
                loop.clock().instant()));

        CompletableFuture<?> negotiation = created.openLocalStream(true);
        if (offerer) {
            negotiation = negotiation.thenCompose(s -> created.createOffer());
        }
        negotiation.whenCompleteAsync((ignored, err) -> {
            if (err != null && session == created && !created.isClosed()) {
                LOG.warn("Matchmaking negotiation with {} failed: {}", created.partnerId(), err.getMessage());
            }
        }, loop);
    }

    private void onPeerGone(String reason) {
        if (state != MatchmakingState.MATCHED) {
            LOG.debug("{} ignored in {}", reason, state);
            return;
        }
        teardown(reason);
        state = MatchmakingState.IDLE;
    }

    private void teardown(String reason) {
        PeerSession current = session;
        if (current == null) {
            return;
        }
        session = null;
        String room = roomId;
        roomId = null;
        current.cleanup();
        LOG.info("Match with {} ended ({})", current.partnerId(), reason);
        publisher.publishEvent(new MatchEndedEvent(room, current.partnerId(), reason, loop.clock().instant()));
    }
}
