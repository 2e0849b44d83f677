package com.phillippitts.peercall.service.session;

/**
 * Releasable token proving that one {@link SessionType} is bound to the shared negotiation
 * events. {@link #release()} is idempotent.
 */
public interface SignalingOwnership {

    SessionType sessionType();

    boolean isReleased();

    void release();
}
