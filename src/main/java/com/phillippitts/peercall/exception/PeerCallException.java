package com.phillippitts.peercall.exception;

import java.util.Objects;

/**
 * Base exception for all peerCall application-specific errors.
 * All domain exceptions extend this class and carry an {@link ErrorKind} so the REST
 * boundary and the UI can react to the category without parsing messages.
 */
public class PeerCallException extends RuntimeException {

    private final ErrorKind kind;

    public PeerCallException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public PeerCallException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
