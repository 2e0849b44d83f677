package com.phillippitts.peercall.service.media;

/**
 * Connection state reported by a {@link MediaTransport}.
 */
public enum TransportState {
    NEW,
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    FAILED,
    CLOSED
}
