package com.phillippitts.peercall.service.signaling.transport;

import com.phillippitts.peercall.config.properties.SignalingProperties;
import com.phillippitts.peercall.service.loop.EventLoop;
import com.phillippitts.peercall.service.loop.ScheduledTask;
import com.phillippitts.peercall.util.JsonSupport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link SignalingTransport} over a WebSocket with JSON text frames.
 *
 * <p>Frames:
 * <ul>
 *   <li>emit: {@code {"event":name,"data":{...},"ack":n}} ({@code ack} only when acknowledged)</li>
 *   <li>ack: {@code {"ack":n,"data":{...}}}</li>
 *   <li>event: {@code {"event":name,"data":{...}}}</li>
 *   <li>hello: {@code {"event":"connected","data":{"id":...}}} right after the socket opens</li>
 * </ul>
 *
 * <p>An unrequested close schedules a reconnect with exponential backoff starting at
 * {@code signaling.reconnect-delay-ms}, capped at {@code signaling.reconnect-max-delay-ms}.
 * Reconnect timers run on the event loop; socket callbacks arrive on client threads.
 *
 * @since 1.0
 */
public class WebSocketSignalingTransport implements SignalingTransport {

    private static final Logger LOG = LogManager.getLogger(WebSocketSignalingTransport.class);

    static final String HELLO_EVENT = "connected";

    private final WebSocketClient client;
    private final SignalingProperties props;
    private final EventLoop loop;

    private final AtomicInteger ackSeq = new AtomicInteger();
    private final Map<Integer, AckCallback> pendingAcks = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    private volatile Listener listener;
    private volatile WebSocketSession session;
    private volatile boolean connected;

    // Guarded by lock
    private boolean connecting;
    private boolean stopRequested;
    private int reconnectAttempt;
    private ScheduledTask reconnectTimer = ScheduledTask.NONE;

    public WebSocketSignalingTransport(WebSocketClient client, SignalingProperties props, EventLoop loop) {
        this.client = Objects.requireNonNull(client, "client");
        this.props = Objects.requireNonNull(props, "props");
        this.loop = Objects.requireNonNull(loop, "loop");
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }

    @Override
    public void connect() {
        synchronized (lock) {
            stopRequested = false;
            if (connecting || connected) {
                return;
            }
            connecting = true;
            reconnectTimer.cancel();
        }
        LOG.info("Connecting to signaling relay {}", props.getUrl());
        client.execute(new FrameHandler(), props.getUrl()).whenComplete((ws, err) -> {
            if (err != null) {
                LOG.warn("Signaling handshake failed: {}", err.getMessage());
                synchronized (lock) {
                    connecting = false;
                }
                scheduleReconnect("handshake failed");
            }
        });
    }

    @Override
    public void disconnect() {
        WebSocketSession current;
        synchronized (lock) {
            stopRequested = true;
            reconnectTimer.cancel();
            current = session;
        }
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                LOG.warn("Error closing signaling socket", e);
            }
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean emit(String event, JSONObject data, AckCallback ack) {
        WebSocketSession current = session;
        if (!connected || current == null || !current.isOpen()) {
            return false;
        }
        JSONObject frame = new JSONObject()
                .put("event", event)
                .put("data", JsonSupport.orEmpty(data));
        int id = -1;
        if (ack != null) {
            id = ackSeq.incrementAndGet();
            pendingAcks.put(id, ack);
            frame.put("ack", id);
        }
        try {
            // WebSocketSession is not safe for concurrent sends
            synchronized (current) {
                current.sendMessage(new TextMessage(frame.toString()));
            }
            return true;
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to write {} frame: {}", event, e.getMessage());
            if (id > 0) {
                pendingAcks.remove(id);
            }
            return false;
        }
    }

    Duration reconnectDelay(int attempt) {
        long base = props.getReconnectDelayMs();
        long cap = Math.max(base, props.getReconnectMaxDelayMs());
        long delay = base;
        for (int i = 1; i < attempt && delay < cap; i++) {
            delay = delay * 2;
        }
        return Duration.ofMillis(Math.min(delay, cap));
    }

    private void scheduleReconnect(String reason) {
        synchronized (lock) {
            if (stopRequested) {
                return;
            }
            reconnectAttempt++;
            Duration delay = reconnectDelay(reconnectAttempt);
            LOG.info("Reconnecting to signaling relay in {} ms (attempt {}, reason: {})",
                    delay.toMillis(), reconnectAttempt, reason);
            reconnectTimer = loop.schedule(this::connect, delay);
        }
    }

    void handleFrame(String payload) {
        JSONObject frame;
        try {
            frame = new JSONObject(payload);
        } catch (JSONException e) {
            LOG.warn("Dropping malformed signaling frame ({} chars)", payload.length());
            return;
        }
        if (frame.has("ack") && !frame.has("event")) {
            AckCallback callback = pendingAcks.remove(frame.optInt("ack", -1));
            if (callback == null) {
                LOG.debug("Ack {} has no pending request", frame.opt("ack"));
                return;
            }
            callback.onAck(JsonSupport.orEmpty(frame.optJSONObject("data")));
            return;
        }
        String event = JsonSupport.optString(frame, "event");
        if (event == null) {
            LOG.debug("Dropping frame without event name");
            return;
        }
        JSONObject data = JsonSupport.orEmpty(frame.optJSONObject("data"));
        Listener current = listener;
        if (HELLO_EVENT.equals(event)) {
            synchronized (lock) {
                connected = true;
                connecting = false;
                reconnectAttempt = 0;
            }
            if (current != null) {
                current.onConnected(JsonSupport.optString(data, "id"));
            }
            return;
        }
        if (current != null) {
            current.onEvent(event, data);
        }
    }

    private void handleClosed(String reason) {
        boolean willReconnect;
        synchronized (lock) {
            connected = false;
            connecting = false;
            session = null;
            willReconnect = !stopRequested;
        }
        pendingAcks.clear();
        Listener current = listener;
        if (current != null) {
            current.onDisconnected(reason, willReconnect);
        }
        if (willReconnect) {
            scheduleReconnect(reason);
        }
    }

    private final class FrameHandler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession ws) {
            LOG.debug("Signaling socket open; waiting for hello");
            session = ws;
        }

        @Override
        protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
            handleFrame(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession ws, Throwable exception) {
            LOG.warn("Signaling transport error: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
            handleClosed(status.getReason() == null ? "code " + status.getCode() : status.getReason());
        }
    }
}
