package com.phillippitts.peercall.service.matchmaking.event;

import java.time.Instant;

/**
 * The relay paired this client with a partner.
 *
 * @param offerer {@code true} if this side creates the offer
 */
public record MatchStartedEvent(String roomId, String partnerId, boolean offerer, Instant at) { }
