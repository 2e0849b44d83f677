package com.phillippitts.peercall.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Timing properties for the call state machine.
 *
 * <p>The incoming bound is deliberately longer than the outgoing one so that the relay's own
 * {@code call:timeout} normally wins and the local fallback only fires when that event is lost.
 */
@Validated
@ConfigurationProperties(prefix = "call")
public class CallProperties {

    /** Ringing-Out gives up after this long without accepted/declined. */
    @Positive
    private long outgoingTimeoutMs = 20_000;

    /** Ringing-In falls back to Idle (missed) after this long without a terminal event. */
    @Positive
    private long incomingTimeoutMs = 20_500;

    /** How long canceled/timed-out call ids suppress a late incoming. */
    @Positive
    private long raceGuardTtlMs = 10_000;

    /** Negotiating gives up after this long without the transport connecting. */
    @Positive
    private long negotiationTimeoutMs = 15_000;

    /** Grace period after a remote transport disconnect before the call is hung up. */
    @Positive
    private long disconnectGraceMs = 8_000;

    public Duration outgoingTimeout() {
        return Duration.ofMillis(outgoingTimeoutMs);
    }

    public Duration incomingTimeout() {
        return Duration.ofMillis(incomingTimeoutMs);
    }

    public Duration raceGuardTtl() {
        return Duration.ofMillis(raceGuardTtlMs);
    }

    public Duration negotiationTimeout() {
        return Duration.ofMillis(negotiationTimeoutMs);
    }

    public Duration disconnectGrace() {
        return Duration.ofMillis(disconnectGraceMs);
    }

    public long getOutgoingTimeoutMs() {
        return outgoingTimeoutMs;
    }

    public void setOutgoingTimeoutMs(long outgoingTimeoutMs) {
        this.outgoingTimeoutMs = outgoingTimeoutMs;
    }

    public long getIncomingTimeoutMs() {
        return incomingTimeoutMs;
    }

    public void setIncomingTimeoutMs(long incomingTimeoutMs) {
        this.incomingTimeoutMs = incomingTimeoutMs;
    }

    public long getRaceGuardTtlMs() {
        return raceGuardTtlMs;
    }

    public void setRaceGuardTtlMs(long raceGuardTtlMs) {
        this.raceGuardTtlMs = raceGuardTtlMs;
    }

    public long getNegotiationTimeoutMs() {
        return negotiationTimeoutMs;
    }

    public void setNegotiationTimeoutMs(long negotiationTimeoutMs) {
        this.negotiationTimeoutMs = negotiationTimeoutMs;
    }

    public long getDisconnectGraceMs() {
        return disconnectGraceMs;
    }

    public void setDisconnectGraceMs(long disconnectGraceMs) {
        this.disconnectGraceMs = disconnectGraceMs;
    }
}
