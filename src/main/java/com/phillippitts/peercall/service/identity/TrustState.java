package com.phillippitts.peercall.service.identity;

/**
 * Whether the current channel session carries an acknowledged identity.
 *
 * <pre>
 * UNKNOWN  (no userId known locally)
 * PENDING  (reauth in flight, or disconnected since the last ack)
 * TRUSTED  (relay acknowledged the userId on this connection)
 * FAILED   (relay rejected the reauth, or it never got through)
 * </pre>
 */
public enum TrustState {
    UNKNOWN,
    PENDING,
    TRUSTED,
    FAILED
}
