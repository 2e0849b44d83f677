package com.phillippitts.peercall.service.call;

/**
 * Call lifecycle states.
 *
 * <pre>
 * IDLE -initiate-> DIALING -ack-> RINGING_OUT -accepted-> NEGOTIATING -connected-> ACTIVE
 * IDLE -incoming-> RINGING_IN -accept-> NEGOTIATING
 * NEGOTIATING | ACTIVE -hangup/ended-> ENDING -> IDLE
 * </pre>
 *
 * Every other terminal outcome (decline, cancel, timeout, busy) returns straight to IDLE.
 */
public enum CallState {
    IDLE,
    DIALING,
    RINGING_OUT,
    RINGING_IN,
    NEGOTIATING,
    ACTIVE,
    ENDING;

    public boolean isRinging() {
        return this == RINGING_OUT || this == RINGING_IN;
    }

    /** States in which a media session exists. */
    public boolean hasMedia() {
        return this == NEGOTIATING || this == ACTIVE;
    }
}
