package com.phillippitts.peercall.service.signaling.transport;

import org.json.JSONObject;

/**
 * Raw duplex connection to the signaling relay.
 *
 * <p>Implementations own framing and socket lifecycle, including automatic reconnection after
 * an unrequested disconnect. Listener callbacks may arrive on any thread.
 */
public interface SignalingTransport {

    /** Starts connecting. Idempotent while connecting or connected. */
    void connect();

    /** Closes the connection and stops automatic reconnection. */
    void disconnect();

    boolean isConnected();

    /**
     * Sends an event.
     *
     * @param event wire event name
     * @param data payload
     * @param ack callback for the relay's acknowledgement, or {@code null} for fire-and-forget
     * @return {@code false} when the transport is not connected and nothing was written
     */
    boolean emit(String event, JSONObject data, AckCallback ack);

    void setListener(Listener listener);

    /** Receives the relay's acknowledgement payload. */
    @FunctionalInterface
    interface AckCallback {
        void onAck(JSONObject data);
    }

    /** Transport notifications. */
    interface Listener {

        /**
         * @param connectionId relay-assigned id of the new connection
         */
        void onConnected(String connectionId);

        /**
         * @param reason transport-specific reason
         * @param willReconnect {@code true} when the transport will try to reconnect by itself
         */
        void onDisconnected(String reason, boolean willReconnect);

        void onEvent(String event, JSONObject data);
    }
}
