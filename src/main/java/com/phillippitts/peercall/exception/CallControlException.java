package com.phillippitts.peercall.exception;

/**
 * Thrown when a call-control intent is refused: identity not trusted, the relay rejected the
 * call, the remote side is busy, or the intent does not fit the current call state.
 *
 * <p>{@link #getRemoteError()} holds the relay's error string verbatim (may be {@code null}).
 */
public class CallControlException extends PeerCallException {

    private final String peerId;
    private final String remoteError;

    public CallControlException(ErrorKind kind, String message, String peerId) {
        this(kind, message, peerId, (String) null);
    }

    public CallControlException(ErrorKind kind, String message, String peerId, String remoteError) {
        super(kind, message);
        this.peerId = peerId;
        this.remoteError = remoteError;
    }

    public CallControlException(ErrorKind kind, String message, String peerId, Throwable cause) {
        super(kind, message, cause);
        this.peerId = peerId;
        this.remoteError = null;
    }

    public String getPeerId() {
        return peerId;
    }

    public String getRemoteError() {
        return remoteError;
    }
}
