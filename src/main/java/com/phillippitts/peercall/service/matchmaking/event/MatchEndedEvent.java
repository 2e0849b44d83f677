package com.phillippitts.peercall.service.matchmaking.event;

import java.time.Instant;

/**
 * The current match ended.
 *
 * @param reason {@code peer_left}, {@code peer_stopped}, {@code next} or {@code stop}
 */
public record MatchEndedEvent(String roomId, String partnerId, String reason, Instant at) { }
