package com.phillippitts.peercall.service.media;

import java.util.Objects;

/**
 * Opaque transport candidate.
 *
 * @param candidate candidate line
 * @param sdpMid media stream id (nullable)
 * @param sdpMLineIndex media line index (nullable)
 */
public record IceCandidate(String candidate, String sdpMid, Integer sdpMLineIndex) {

    public IceCandidate {
        Objects.requireNonNull(candidate, "candidate");
    }
}
