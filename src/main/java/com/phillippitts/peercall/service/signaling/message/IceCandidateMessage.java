package com.phillippitts.peercall.service.signaling.message;

import com.phillippitts.peercall.service.media.IceCandidate;

/** {@code ice-candidate {to, candidate}}; inbound copies carry {@code from}. */
public record IceCandidateMessage(String to, String from, IceCandidate candidate) {

    public static IceCandidateMessage outbound(String to, IceCandidate candidate) {
        return new IceCandidateMessage(to, null, candidate);
    }
}
