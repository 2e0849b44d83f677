package com.phillippitts.peercall.service.signaling.message;

/**
 * {@code match_found {roomId, id, userId?}}.
 *
 * @param roomId room assigned by the relay
 * @param partnerConnectionId partner's relay connection id, used as negotiation address
 * @param partnerUserId partner's user id when known
 */
public record MatchFound(String roomId, String partnerConnectionId, String partnerUserId) { }
