package com.phillippitts.peercall.service.signaling;

import com.phillippitts.peercall.config.properties.SignalingProperties;
import com.phillippitts.peercall.exception.ErrorKind;
import com.phillippitts.peercall.exception.SignalingException;
import com.phillippitts.peercall.service.loop.EventLoop;
import com.phillippitts.peercall.service.loop.ScheduledTask;
import com.phillippitts.peercall.service.metrics.CallMetrics;
import com.phillippitts.peercall.service.signaling.transport.SignalingTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Default {@link SignalingChannel} over a {@link SignalingTransport}.
 *
 * <p><b>Threading:</b> transport callbacks arrive on transport threads and are handed to the
 * {@link EventLoop}; every piece of mutable state below is touched only on the loop, except the
 * handler registry (copy-on-write) and the volatile connection fields read by diagnostics.
 *
 * <p><b>Request policy:</b> wait for connect (connect-wait budget), send, wait for the ack
 * (ack timeout). A timed-out attempt, or one that found the channel mid-reconnect, is retried
 * after a jittered backoff. Once attempts are exhausted the future fails with
 * {@link ErrorKind#OFFLINE} if the last attempt never got connected, otherwise
 * {@link ErrorKind#ACK_TIMEOUT}.
 *
 * @since 1.0
 */
public class DefaultSignalingChannel implements SignalingChannel, SignalingTransport.Listener {

    private static final Logger LOG = LogManager.getLogger(DefaultSignalingChannel.class);

    private final SignalingTransport transport;
    private final EventLoop loop;
    private final SignalingProperties props;
    private final CallMetrics metrics;
    private final Random jitter;

    private final Map<String, List<HandlerEntry<?>>> handlers = new ConcurrentHashMap<>();
    private final List<Runnable> connectListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> disconnectListeners = new CopyOnWriteArrayList<>();

    // Loop-confined
    private final List<CompletableFuture<Void>> connectWaiters = new ArrayList<>();
    private final Deque<Runnable> sendBuffer = new ArrayDeque<>();

    private volatile boolean connected;
    private volatile boolean reconnecting;
    private volatile String sessionId;
    private volatile String sessionUserId;

    public DefaultSignalingChannel(SignalingTransport transport,
                                   EventLoop loop,
                                   SignalingProperties props,
                                   CallMetrics metrics,
                                   Random jitter) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.jitter = Objects.requireNonNull(jitter, "jitter");
        this.transport.setListener(this);
    }

    @Override
    public void connect() {
        if (connected) {
            LOG.debug("Signaling channel already connected; skip connect");
            return;
        }
        transport.connect();
    }

    @Override
    public boolean isConnected() {
        return connected && !reconnecting;
    }

    // ---------------------------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------------------------

    @Override
    public <T> void send(SignalingEvent<T> event, T payload) {
        Objects.requireNonNull(event, "event");
        JSONObject data = event.encode(payload);
        loop.execute(() -> {
            if (isConnected() && transport.emit(event.name(), data, null)) {
                LOG.debug("Sent {}", event.name());
                return;
            }
            if (sendBuffer.size() >= props.getSendBufferSize()) {
                LOG.warn("Send buffer full ({}); dropping oldest before buffering {}",
                        props.getSendBufferSize(), event.name());
                sendBuffer.pollFirst();
            }
            if (props.getSendBufferSize() > 0) {
                sendBuffer.addLast(() -> transport.emit(event.name(), data, null));
                LOG.debug("Channel offline; buffered {} ({} pending)", event.name(), sendBuffer.size());
            } else {
                LOG.warn("Channel offline; dropped {}", event.name());
            }
            transport.connect();
        });
    }

    @Override
    public <Q, A> CompletableFuture<A> request(SignalingRequest<Q, A> request, Q payload) {
        return request(request, payload, Duration.ofMillis(props.getAckTimeoutMs()), props.getRetries());
    }

    @Override
    public <Q, A> CompletableFuture<A> request(SignalingRequest<Q, A> request,
                                               Q payload,
                                               Duration timeout,
                                               int retries) {
        Objects.requireNonNull(request, "request");
        Duration ackTimeout = timeout == null || timeout.isZero() || timeout.isNegative()
                ? Duration.ofMillis(props.getAckTimeoutMs())
                : timeout;
        int maxAttempts = Math.max(0, retries) + 1;
        JSONObject data = request.event().encode(payload);
        CompletableFuture<A> result = new CompletableFuture<>();
        loop.execute(() -> attempt(request, data, ackTimeout, 1, maxAttempts, result));
        return result;
    }

    private <Q, A> void attempt(SignalingRequest<Q, A> request,
                                JSONObject data,
                                Duration ackTimeout,
                                int attempt,
                                int maxAttempts,
                                CompletableFuture<A> result) {
        if (result.isDone()) {
            return;
        }
        awaitConnected(Duration.ofMillis(props.getConnectWaitMs())).whenComplete((ignored, offline) -> {
            if (offline != null) {
                if (attempt == 1) {
                    // Offline before anything was sent: fail fast instead of burning retries.
                    LOG.warn("Request {} failed: channel offline after {} ms",
                            request.name(), props.getConnectWaitMs());
                    result.completeExceptionally(SignalingException.offline(request.name()));
                    return;
                }
                retryOrFail(request, data, ackTimeout, attempt, maxAttempts, result, ErrorKind.OFFLINE);
                return;
            }
            sendOnce(request.name(), data, ackTimeout).whenComplete((ack, err) -> {
                if (err == null) {
                    try {
                        result.complete(request.decodeAck(ack));
                    } catch (RuntimeException decodeError) {
                        LOG.warn("Malformed ack for {}: {}", request.name(), decodeError.toString());
                        result.completeExceptionally(decodeError);
                    }
                    return;
                }
                LOG.debug("Attempt {}/{} for {} failed: {}", attempt, maxAttempts, request.name(), err.getMessage());
                retryOrFail(request, data, ackTimeout, attempt, maxAttempts, result, ErrorKind.ACK_TIMEOUT);
            });
        });
    }

    private <Q, A> void retryOrFail(SignalingRequest<Q, A> request,
                                    JSONObject data,
                                    Duration ackTimeout,
                                    int attempt,
                                    int maxAttempts,
                                    CompletableFuture<A> result,
                                    ErrorKind lastFailure) {
        if (attempt >= maxAttempts) {
            SignalingException failure = lastFailure == ErrorKind.OFFLINE
                    ? SignalingException.offline(request.name())
                    : SignalingException.ackTimeout(request.name(), attempt);
            LOG.warn("Request {} gave up after {} attempt(s): {}", request.name(), attempt, lastFailure);
            result.completeExceptionally(failure);
            return;
        }
        metrics.incrementAckRetry(request.name());
        Duration backoff = nextBackoff();
        LOG.debug("Retrying {} in {} ms (attempt {}/{})", request.name(), backoff.toMillis(), attempt + 1, maxAttempts);
        loop.schedule(() -> attempt(request, data, ackTimeout, attempt + 1, maxAttempts, result), backoff);
    }

    private CompletableFuture<JSONObject> sendOnce(String eventName, JSONObject data, Duration ackTimeout) {
        PendingAck pending = new PendingAck();
        boolean sent = transport.emit(eventName, data, ack -> loop.execute(() -> {
            if (!pending.resolve(ack)) {
                LOG.debug("Late ack for {} ignored", eventName);
            }
        }));
        if (!sent) {
            pending.fail(new IllegalStateException("Transport not connected"));
            return pending.future();
        }
        ScheduledTask timer = loop.schedule(() -> {
            if (pending.timeOut(eventName)) {
                LOG.debug("Ack timeout for {} after {} ms", eventName, ackTimeout.toMillis());
            }
        }, ackTimeout);
        pending.armTimer(timer);
        return pending.future();
    }

    Duration nextBackoff() {
        long min = props.getBackoffMinMs();
        long max = Math.max(min, props.getBackoffMaxMs());
        long span = max - min;
        long delay = span == 0 ? min : min + (long) (jitter.nextDouble() * span);
        return Duration.ofMillis(delay);
    }

    /** Completes on the loop once connected, or fails after {@code budget}. */
    private CompletableFuture<Void> awaitConnected(Duration budget) {
        if (isConnected()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> waiter = new CompletableFuture<>();
        connectWaiters.add(waiter);
        loop.schedule(() -> {
            if (connectWaiters.remove(waiter)) {
                waiter.completeExceptionally(SignalingException.offline("connect"));
            }
        }, budget);
        transport.connect();
        return waiter;
    }

    // ---------------------------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------------------------

    @Override
    public <T> Subscription on(SignalingEvent<T> event, Consumer<T> handler) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(handler, "handler");
        HandlerEntry<T> entry = new HandlerEntry<>(event, handler);
        handlers.computeIfAbsent(event.name(), k -> new CopyOnWriteArrayList<>()).add(entry);
        return () -> {
            List<HandlerEntry<?>> list = handlers.get(event.name());
            if (list != null) {
                list.remove(entry);
            }
        };
    }

    @Override
    public Subscription onConnect(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        connectListeners.add(listener);
        if (connected) {
            loop.execute(() -> {
                if (connectListeners.contains(listener)) {
                    listener.run();
                }
            });
        }
        return () -> connectListeners.remove(listener);
    }

    @Override
    public Subscription onDisconnect(Consumer<String> listener) {
        Objects.requireNonNull(listener, "listener");
        disconnectListeners.add(listener);
        return () -> disconnectListeners.remove(listener);
    }

    @Override
    public int listenerCount(SignalingEvent<?> event) {
        List<HandlerEntry<?>> list = handlers.get(event.name());
        return list == null ? 0 : list.size();
    }

    @Override
    public Optional<String> sessionId() {
        return Optional.ofNullable(sessionId);
    }

    @Override
    public Optional<String> sessionUserId() {
        return Optional.ofNullable(sessionUserId);
    }

    @Override
    public void bindSessionUser(String userId) {
        this.sessionUserId = userId;
    }

    // SignalingTransport.Listener -- called from transport threads

    @Override
    public void onConnected(String connectionId) {
        loop.execute(() -> {
            connected = true;
            reconnecting = false;
            sessionId = connectionId;
            LOG.info("Signaling channel connected (id={})", connectionId);

            List<CompletableFuture<Void>> waiters = new ArrayList<>(connectWaiters);
            connectWaiters.clear();
            waiters.forEach(w -> w.complete(null));

            flushSendBuffer();
            for (Runnable listener : connectListeners) {
                runSafely("connect listener", listener);
            }
        });
    }

    @Override
    public void onDisconnected(String reason, boolean willReconnect) {
        loop.execute(() -> {
            boolean wasConnected = connected;
            connected = false;
            reconnecting = willReconnect;
            sessionId = null;
            sessionUserId = null;
            LOG.warn("Signaling channel disconnected ({}) reconnecting={}", reason, willReconnect);
            if (!wasConnected) {
                return;
            }
            for (Consumer<String> listener : disconnectListeners) {
                runSafely("disconnect listener", () -> listener.accept(reason));
            }
        });
    }

    @Override
    public void onEvent(String event, JSONObject data) {
        loop.execute(() -> dispatch(event, data));
    }

    private void dispatch(String event, JSONObject data) {
        List<HandlerEntry<?>> list = handlers.get(event);
        if (list == null || list.isEmpty()) {
            LOG.debug("No handler for inbound {}", event);
            return;
        }
        for (HandlerEntry<?> entry : list) {
            runSafely("handler for " + event, () -> entry.deliver(data));
        }
    }

    private void flushSendBuffer() {
        if (sendBuffer.isEmpty()) {
            return;
        }
        LOG.debug("Flushing {} buffered event(s)", sendBuffer.size());
        while (!sendBuffer.isEmpty()) {
            sendBuffer.pollFirst().run();
        }
    }

    private static void runSafely(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.error("Signaling {} threw", what, e);
        }
    }

    private static final class HandlerEntry<T> {
        private final SignalingEvent<T> event;
        private final Consumer<T> handler;

        HandlerEntry(SignalingEvent<T> event, Consumer<T> handler) {
            this.event = event;
            this.handler = handler;
        }

        void deliver(JSONObject data) {
            handler.accept(event.decode(data));
        }
    }
}
