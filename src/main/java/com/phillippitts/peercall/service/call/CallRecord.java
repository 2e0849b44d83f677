package com.phillippitts.peercall.service.call;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of the current call. Replaced, never mutated, by {@link CallSessionManager}.
 *
 * @param callId relay-issued id; {@code null} while dialing
 * @param peerId the other party
 * @param peerNick caller nickname from {@code call:incoming}, if any
 * @param direction who placed the call
 * @param state lifecycle state
 * @param roomId negotiation room, set once negotiation starts
 * @param createdAt when the record was created
 */
public record CallRecord(String callId,
                         String peerId,
                         String peerNick,
                         CallDirection direction,
                         CallState state,
                         String roomId,
                         Instant createdAt) {

    public CallRecord {
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static CallRecord outgoing(String peerId, Instant now) {
        return new CallRecord(null, peerId, null, CallDirection.OUTGOING, CallState.DIALING, null, now);
    }

    public static CallRecord incoming(String callId, String peerId, String peerNick, Instant now) {
        return new CallRecord(callId, peerId, peerNick, CallDirection.INCOMING, CallState.RINGING_IN, null, now);
    }

    public CallRecord withState(CallState next) {
        return new CallRecord(callId, peerId, peerNick, direction, next, roomId, createdAt);
    }

    public CallRecord withCallId(String id) {
        return new CallRecord(id, peerId, peerNick, direction, state, roomId, createdAt);
    }

    public CallRecord withRoomId(String room) {
        return new CallRecord(callId, peerId, peerNick, direction, state, room, createdAt);
    }

    public boolean isOutgoing() {
        return direction == CallDirection.OUTGOING;
    }

    /** True if {@code id} names this call. */
    public boolean matches(String id) {
        return callId != null && callId.equals(id);
    }
}
