package com.phillippitts.peercall.service.ledger.event;

import java.time.Instant;

/**
 * Published once per missed-call occurrence.
 *
 * @param peerId caller whose counter was incremented
 * @param callId the missed call
 * @param count counter value after the increment
 */
public record MissedCallRecordedEvent(String peerId, String callId, int count, Instant at) { }
