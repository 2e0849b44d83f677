package com.phillippitts.peercall.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the signaling channel and its relay transport.
 */
@Validated
@ConfigurationProperties(prefix = "signaling")
public class SignalingProperties {

    /** Relay WebSocket endpoint. */
    private String url = "ws://localhost:3000/signal";

    /** Connect automatically when the application starts. */
    private boolean autoConnect = true;

    /** How long request() waits for the channel to (re)connect before failing with Offline. */
    @Positive(message = "Connect wait must be positive")
    private long connectWaitMs = 7000;

    /** Per-attempt acknowledgement timeout. */
    @Positive(message = "Ack timeout must be positive")
    private long ackTimeoutMs = 12000;

    /** Retries after the first attempt (total attempts = retries + 1). */
    @Min(0)
    private int retries = 2;

    /** Lower bound of the jittered backoff between attempts. */
    @Min(0)
    private long backoffMinMs = 250;

    /** Upper bound of the jittered backoff between attempts. */
    @Min(0)
    private long backoffMaxMs = 550;

    /** Initial transport reconnect delay; doubles per failed attempt. */
    @Positive
    private long reconnectDelayMs = 1000;

    /** Cap for the transport reconnect delay. */
    @Positive
    private long reconnectMaxDelayMs = 5000;

    /** Maximum number of fire-and-forget events buffered while disconnected. */
    @Min(0)
    private int sendBufferSize = 64;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public boolean isAutoConnect() {
        return autoConnect;
    }

    public void setAutoConnect(boolean autoConnect) {
        this.autoConnect = autoConnect;
    }

    public long getConnectWaitMs() {
        return connectWaitMs;
    }

    public void setConnectWaitMs(long connectWaitMs) {
        this.connectWaitMs = connectWaitMs;
    }

    public long getAckTimeoutMs() {
        return ackTimeoutMs;
    }

    public void setAckTimeoutMs(long ackTimeoutMs) {
        this.ackTimeoutMs = ackTimeoutMs;
    }

    public int getRetries() {
        return retries;
    }

    public void setRetries(int retries) {
        this.retries = retries;
    }

    public long getBackoffMinMs() {
        return backoffMinMs;
    }

    public void setBackoffMinMs(long backoffMinMs) {
        this.backoffMinMs = backoffMinMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public void setBackoffMaxMs(long backoffMaxMs) {
        this.backoffMaxMs = backoffMaxMs;
    }

    public long getReconnectDelayMs() {
        return reconnectDelayMs;
    }

    public void setReconnectDelayMs(long reconnectDelayMs) {
        this.reconnectDelayMs = reconnectDelayMs;
    }

    public long getReconnectMaxDelayMs() {
        return reconnectMaxDelayMs;
    }

    public void setReconnectMaxDelayMs(long reconnectMaxDelayMs) {
        this.reconnectMaxDelayMs = reconnectMaxDelayMs;
    }

    public int getSendBufferSize() {
        return sendBufferSize;
    }

    public void setSendBufferSize(int sendBufferSize) {
        this.sendBufferSize = sendBufferSize;
    }
}
