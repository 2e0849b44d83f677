package com.phillippitts.peercall.service.signaling.message;

import com.phillippitts.peercall.service.media.SessionDescription;

/**
 * {@code offer {to, offer}} / {@code answer {to, answer}}. Inbound copies carry {@code from}
 * instead of {@code to}.
 */
public record DescriptionMessage(String to, String from, SessionDescription description) {

    public static DescriptionMessage outbound(String to, SessionDescription description) {
        return new DescriptionMessage(to, null, description);
    }
}
