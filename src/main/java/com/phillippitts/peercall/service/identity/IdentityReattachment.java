package com.phillippitts.peercall.service.identity;

import com.phillippitts.peercall.config.properties.IdentityProperties;
import com.phillippitts.peercall.exception.PeerCallException;
import com.phillippitts.peercall.service.identity.event.IdentityReattachedEvent;
import com.phillippitts.peercall.service.identity.event.ReauthFailedEvent;
import com.phillippitts.peercall.service.loop.EventLoop;
import com.phillippitts.peercall.service.signaling.SignalingChannel;
import com.phillippitts.peercall.service.signaling.SignalingEvents;
import com.phillippitts.peercall.service.signaling.message.IdentityAck;
import com.phillippitts.peercall.service.signaling.message.IdentityAttachRequest;
import com.phillippitts.peercall.service.signaling.message.Reauth;
import com.phillippitts.peercall.service.store.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Re-establishes the local identity on the signaling channel.
 *
 * <p><b>Attach:</b> {@link #attach(String, ProfileDelta)} coalesces concurrent callers into one
 * in-flight {@code identity:attach}; every caller gets the same {@link AttachResult}. Transport
 * failures (offline, ack timeout) resolve as {@code ok:false} rather than exceptionally.
 *
 * <p><b>Reauth:</b> on every (re)connect, when a userId is stored locally but the channel session
 * does not carry it, a {@code reauth {userId}} is sent. Until it is acknowledged the trust state
 * is {@link TrustState#PENDING} and call initiation is refused.
 *
 * @since 1.0
 */
public class IdentityReattachment {

    private static final Logger LOG = LogManager.getLogger(IdentityReattachment.class);

    public static final String USER_ID_KEY = "userId";
    public static final String INSTALL_ID_KEY = "installId";

    private final SignalingChannel channel;
    private final KeyValueStore store;
    private final EventLoop loop;
    private final ApplicationEventPublisher publisher;
    private final IdentityProperties props;

    private final AtomicReference<CompletableFuture<AttachResult>> inFlight = new AtomicReference<>();
    private volatile TrustState trust;

    public IdentityReattachment(SignalingChannel channel,
                                KeyValueStore store,
                                EventLoop loop,
                                ApplicationEventPublisher publisher,
                                IdentityProperties props) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.store = Objects.requireNonNull(store, "store");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.props = Objects.requireNonNull(props, "props");
        this.trust = knownUserId().isPresent() ? TrustState.PENDING : TrustState.UNKNOWN;

        channel.onConnect(this::onConnected);
        channel.onDisconnect(reason -> {
            if (trust == TrustState.TRUSTED) {
                trust = TrustState.PENDING;
                LOG.debug("Identity trust suspended until reauth ({})", reason);
            }
        });
    }

    /**
     * Attaches this installation to a user on the relay. Concurrent calls share one request.
     */
    public CompletableFuture<AttachResult> attach(String installId, ProfileDelta profile) {
        CompletableFuture<AttachResult> mine = new CompletableFuture<>();
        CompletableFuture<AttachResult> existing = inFlight.compareAndExchange(null, mine);
        if (existing != null) {
            LOG.debug("identity:attach already in flight; joining it");
            return existing;
        }
        ProfileDelta delta = profile == null ? ProfileDelta.empty() : profile;
        LOG.info("Attaching identity for install {}", installId);
        channel.request(SignalingEvents.IDENTITY_ATTACH,
                        new IdentityAttachRequest(installId, delta.nick(), delta.avatarUrl()))
                .whenComplete((ack, err) -> {
                    AttachResult result = err != null ? AttachResult.failure(describe(err)) : toResult(ack);
                    if (result.ok()) {
                        store.put(USER_ID_KEY, result.userId());
                        channel.bindSessionUser(result.userId());
                        trust = TrustState.TRUSTED;
                        LOG.info("Identity attached as {}", result.userId());
                        publisher.publishEvent(new IdentityReattachedEvent(result.userId(), loop.clock().instant()));
                    } else {
                        LOG.warn("identity:attach failed: {}", result.error());
                    }
                    inFlight.compareAndSet(mine, null);
                    mine.complete(result);
                });
        return mine;
    }

    /** Trust state of the current channel session. */
    public TrustState trustState() {
        return trust;
    }

    public boolean isTrusted() {
        return trust == TrustState.TRUSTED;
    }

    public Optional<String> knownUserId() {
        return store.get(USER_ID_KEY);
    }

    /**
     * Configured install id, or the persisted generated one.
     */
    public String installId() {
        if (props.getInstallId() != null && !props.getInstallId().isBlank()) {
            return props.getInstallId();
        }
        return store.get(INSTALL_ID_KEY).orElseGet(() -> {
            String generated = UUID.randomUUID().toString();
            store.put(INSTALL_ID_KEY, generated);
            LOG.info("Generated install id {}", generated);
            return generated;
        });
    }

    private void onConnected() {
        Optional<String> userId = knownUserId();
        if (userId.isEmpty()) {
            trust = TrustState.UNKNOWN;
            if (props.isAttachOnConnect()) {
                attach(installId(), new ProfileDelta(props.getNick(), null));
            }
            return;
        }
        if (userId.equals(channel.sessionUserId())) {
            trust = TrustState.TRUSTED;
            return;
        }
        reauth(userId.get());
    }

    private void reauth(String userId) {
        trust = TrustState.PENDING;
        LOG.info("Reauthenticating {} on new connection", userId);
        channel.request(SignalingEvents.REAUTH, new Reauth(userId)).whenComplete((ack, err) -> {
            String error = err != null ? describe(err) : (ack.ok() ? null : orDefault(ack.error()));
            if (error == null) {
                channel.bindSessionUser(userId);
                trust = TrustState.TRUSTED;
                LOG.info("Reauth acknowledged for {}", userId);
                publisher.publishEvent(new IdentityReattachedEvent(userId, loop.clock().instant()));
                return;
            }
            trust = TrustState.FAILED;
            LOG.warn("Reauth failed for {}: {}", userId, error);
            publisher.publishEvent(new ReauthFailedEvent(userId, error, loop.clock().instant()));
        });
    }

    private static AttachResult toResult(IdentityAck ack) {
        if (ack.ok() && ack.userId() != null) {
            return AttachResult.success(ack.userId());
        }
        return AttachResult.failure(ack.ok() ? "missing userId" : orDefault(ack.error()));
    }

    private static String orDefault(String error) {
        return error == null ? "rejected" : error;
    }

    private static String describe(Throwable err) {
        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        if (cause instanceof PeerCallException pce) {
            return pce.getKind().name();
        }
        return cause.getClass().getSimpleName();
    }
}
