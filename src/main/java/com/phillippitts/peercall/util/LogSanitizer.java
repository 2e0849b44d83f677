package com.phillippitts.peercall.util;

/** Utility for privacy-safe logging of negotiation payloads. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Describes an SDP body by size only.
     */
    public static String describeSdp(String sdp) {
        return sdp == null ? "sdp[none]" : "sdp[" + sdp.length() + " chars]";
    }
}
