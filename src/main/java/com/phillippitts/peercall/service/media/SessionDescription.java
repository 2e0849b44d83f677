package com.phillippitts.peercall.service.media;

import java.util.Objects;

/**
 * Opaque session description exchanged during negotiation. The SDP body is never interpreted
 * by the call layer.
 *
 * @param type "offer" or "answer"
 * @param sdp transport-specific description body
 */
public record SessionDescription(String type, String sdp) {

    public static final String OFFER = "offer";
    public static final String ANSWER = "answer";

    public SessionDescription {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sdp, "sdp");
    }

    public static SessionDescription offer(String sdp) {
        return new SessionDescription(OFFER, sdp);
    }

    public static SessionDescription answer(String sdp) {
        return new SessionDescription(ANSWER, sdp);
    }

    public boolean isOffer() {
        return OFFER.equals(type);
    }
}
