package com.phillippitts.peercall.service.call.event;

import java.time.Instant;

/**
 * The media transport of an active call dropped without {@code call:ended}.
 */
public record RemoteDisconnectedEvent(String callId, String peerId, Instant at) { }
