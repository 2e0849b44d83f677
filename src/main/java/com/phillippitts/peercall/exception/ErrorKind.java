package com.phillippitts.peercall.exception;

/**
 * Failure taxonomy shared by the signaling layer, the call state machine and the REST boundary.
 *
 * <p>{@link #SUPPRESSED_EVENT} is never thrown; it labels deliberate race-guard no-ops in logs
 * and metrics.
 */
public enum ErrorKind {
    /** Channel unreachable within the connect-wait budget. */
    OFFLINE,
    /** Identity reattachment pending or failed; call-control traffic is not trusted yet. */
    NOT_AUTHENTICATED,
    /** Relay answered {@code call:initiate} with {@code ok:false}. */
    CALL_INITIATE_FAILED,
    /** Remote side busy or room full. Terminal. */
    ROOM_FULL,
    /** Acknowledgement did not arrive after all retries. */
    ACK_TIMEOUT,
    /** Intent issued in a state that does not accept it. */
    INVALID_STATE,
    /** Stale event dropped on purpose. */
    SUPPRESSED_EVENT
}
