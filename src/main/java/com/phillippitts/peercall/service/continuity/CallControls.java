package com.phillippitts.peercall.service.continuity;

import com.phillippitts.peercall.service.call.CallRecord;

import java.util.concurrent.CompletableFuture;

/**
 * Controls of one live call, reachable without holding the call's owner.
 *
 * <p>Implementations run each operation on the call event loop.
 */
public interface CallControls {

    /** Registry key; the call id for direct calls. */
    String key();

    /** Current record of the call. */
    CallRecord record();

    boolean isLive();

    /** @return future of the new microphone state */
    CompletableFuture<Boolean> toggleMic();

    /** @return future of the new remote audio state */
    CompletableFuture<Boolean> toggleRemoteAudio();

    /** Ends the call. Idempotent. */
    CompletableFuture<Void> hangup();
}
