package com.phillippitts.peercall.service.continuity.event;

import java.time.Instant;

/**
 * Picture-in-picture entered or left.
 *
 * @param local {@code true} for this side's bridge, {@code false} when the partner reported its state
 */
public record ContinuityStateEvent(boolean inPiP, boolean local, String callKey, String peerId, Instant at) { }
