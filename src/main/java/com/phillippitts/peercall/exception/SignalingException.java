package com.phillippitts.peercall.exception;

/**
 * Thrown when the signaling channel cannot deliver a request: the relay stayed unreachable
 * for the connect-wait budget ({@link ErrorKind#OFFLINE}) or no acknowledgement arrived after
 * all retries ({@link ErrorKind#ACK_TIMEOUT}).
 */
public class SignalingException extends PeerCallException {

    private final String eventName;

    public SignalingException(ErrorKind kind, String eventName, String message) {
        super(kind, message + " (event: " + eventName + ")");
        this.eventName = eventName;
    }

    public SignalingException(ErrorKind kind, String eventName, String message, Throwable cause) {
        super(kind, message + " (event: " + eventName + ")", cause);
        this.eventName = eventName;
    }

    public static SignalingException offline(String eventName) {
        return new SignalingException(ErrorKind.OFFLINE, eventName, "Signaling channel offline");
    }

    public static SignalingException ackTimeout(String eventName, int attempts) {
        return new SignalingException(ErrorKind.ACK_TIMEOUT, eventName,
                "No acknowledgement after " + attempts + " attempt(s)");
    }

    public String getEventName() {
        return eventName;
    }
}
