package com.phillippitts.peercall.service.session;

import com.phillippitts.peercall.service.signaling.SignalingChannel;
import com.phillippitts.peercall.service.signaling.SignalingEvents;
import com.phillippitts.peercall.service.signaling.Subscription;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Central arbiter of the shared negotiation handlers.
 *
 * <p>Exactly one holder at a time. {@link #acquire(SessionType, NegotiationHandler)} binds the
 * holder's handler to {@code offer}, {@code answer} and {@code ice-candidate}; a second acquire,
 * by either type, is refused until the holder releases its token. The first holder stays
 * authoritative, so two live sessions never both handle one inbound offer.
 *
 * <p><b>Thread Safety:</b> acquire and release are synchronized.
 *
 * @since 1.0
 */
public class SignalingOwnershipRegistry {

    private static final Logger LOG = LogManager.getLogger(SignalingOwnershipRegistry.class);

    private final SignalingChannel channel;
    private Token current;

    public SignalingOwnershipRegistry(SignalingChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * @return the ownership token, or empty if another session already holds it
     */
    public synchronized Optional<SignalingOwnership> acquire(SessionType type, NegotiationHandler handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        if (current != null) {
            LOG.warn("Signaling ownership requested by {} while held by {}; refused", type, current.type);
            return Optional.empty();
        }
        List<Subscription> subscriptions = List.of(
                channel.on(SignalingEvents.OFFER, handler::onOffer),
                channel.on(SignalingEvents.ANSWER, handler::onAnswer),
                channel.on(SignalingEvents.ICE_CANDIDATE, handler::onIceCandidate));
        current = new Token(type, subscriptions);
        LOG.debug("Signaling ownership acquired by {}", type);
        return Optional.of(current);
    }

    public synchronized Optional<SessionType> holder() {
        return current == null ? Optional.empty() : Optional.of(current.type);
    }

    private synchronized void release(Token token) {
        token.subscriptions.forEach(Subscription::cancel);
        if (current == token) {
            current = null;
            LOG.debug("Signaling ownership released by {}", token.type);
        }
    }

    private final class Token implements SignalingOwnership {
        private final SessionType type;
        private final List<Subscription> subscriptions;
        private final AtomicBoolean released = new AtomicBoolean(false);

        Token(SessionType type, List<Subscription> subscriptions) {
            this.type = type;
            this.subscriptions = subscriptions;
        }

        @Override
        public SessionType sessionType() {
            return type;
        }

        @Override
        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void release() {
            if (released.compareAndSet(false, true)) {
                SignalingOwnershipRegistry.this.release(this);
            }
        }
    }
}
