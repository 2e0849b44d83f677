package com.phillippitts.peercall.service.call.event;

import java.time.Instant;

/**
 * The media transport of an active call recovered after a {@link RemoteDisconnectedEvent}.
 */
public record RemoteReconnectedEvent(String callId, String peerId, Instant at) { }
