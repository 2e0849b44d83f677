package com.phillippitts.peercall.service.signaling;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Persistent, auto-reconnecting duplex event channel to the signaling relay.
 *
 * <p>All handler and listener callbacks run on the call event loop.
 *
 * @since 1.0
 */
public interface SignalingChannel {

    /** Starts connecting. Idempotent. */
    void connect();

    boolean isConnected();

    /**
     * Fire-and-forget send. While disconnected the event is buffered (bounded) and flushed on the
     * next connect.
     */
    <T> void send(SignalingEvent<T> event, T payload);

    /**
     * Sends an event and waits for the relay's acknowledgement, using the configured timeout and
     * retry policy.
     */
    <Q, A> CompletableFuture<A> request(SignalingRequest<Q, A> request, Q payload);

    /**
     * Sends an event and waits for its acknowledgement.
     *
     * <p>Waits for the channel to connect (bounded by the connect-wait budget), then sends and
     * waits up to {@code timeout} for the acknowledgement. A timed-out or offline attempt is
     * retried up to {@code retries} times with jittered backoff. The future fails with
     * {@link com.phillippitts.peercall.exception.SignalingException} once the budget is spent.
     */
    <Q, A> CompletableFuture<A> request(SignalingRequest<Q, A> request, Q payload, Duration timeout, int retries);

    /**
     * Registers a handler for an inbound event.
     *
     * @return subscription whose {@code cancel()} removes the handler
     */
    <T> Subscription on(SignalingEvent<T> event, Consumer<T> handler);

    /**
     * Registers a connect listener. Invoked on every (re)connect; invoked immediately (on the
     * loop) when the channel is already connected.
     */
    Subscription onConnect(Runnable listener);

    Subscription onDisconnect(Consumer<String> listener);

    /** Number of handlers currently registered for the event. */
    int listenerCount(SignalingEvent<?> event);

    /** Relay connection id of the current connection, if connected. */
    Optional<String> sessionId();

    /** Identity the current channel session carries; cleared on every disconnect. */
    Optional<String> sessionUserId();

    /** Records the identity acknowledged for the current channel session. */
    void bindSessionUser(String userId);
}
