package com.phillippitts.peercall.service.session;

/**
 * The two call modes that compete for the shared negotiation events.
 */
public enum SessionType {
    /** Friend call set up through {@code call:*} control events. */
    DIRECT,
    /** Anonymous call set up by the relay's matchmaking queue. */
    MATCHMAKING
}
