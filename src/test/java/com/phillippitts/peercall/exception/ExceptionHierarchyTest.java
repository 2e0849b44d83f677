package com.phillippitts.peercall.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void peerCallExceptionCarriesKindAndCause() {
        IOException cause = new IOException("socket closed");
        PeerCallException ex = new PeerCallException(ErrorKind.OFFLINE, "wrapper", cause);

        assertThat(ex.getKind()).isEqualTo(ErrorKind.OFFLINE);
        assertThat(ex.getMessage()).isEqualTo("wrapper");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void kindIsRequired() {
        assertThatThrownBy(() -> new PeerCallException(null, "no kind"))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void signalingFactoriesNameTheEvent() {
        SignalingException offline = SignalingException.offline("reauth");
        SignalingException timeout = SignalingException.ackTimeout("call:initiate", 3);

        assertThat(offline.getKind()).isEqualTo(ErrorKind.OFFLINE);
        assertThat(offline.getEventName()).isEqualTo("reauth");
        assertThat(timeout.getKind()).isEqualTo(ErrorKind.ACK_TIMEOUT);
        assertThat(timeout.getMessage()).contains("3 attempt(s)").contains("call:initiate");
    }

    @Test
    void callControlExceptionKeepsRelayError() {
        CallControlException ex = new CallControlException(ErrorKind.ROOM_FULL, "Callee busy", "bob", "room_full");

        assertThat(ex).isInstanceOf(PeerCallException.class);
        assertThat(ex.getPeerId()).isEqualTo("bob");
        assertThat(ex.getRemoteError()).isEqualTo("room_full");
    }

    @Test
    void callControlExceptionWrapsCause() {
        SignalingException cause = SignalingException.offline("call:accept");
        CallControlException ex = new CallControlException(ErrorKind.OFFLINE, "Accept failed", "bob", cause);

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getRemoteError()).isNull();
    }

    @Test
    void callControlExceptionWithoutRelayErrorOrCause() {
        CallControlException ex = new CallControlException(ErrorKind.INVALID_STATE, "Not ringing", "bob");

        assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_STATE);
        assertThat(ex.getPeerId()).isEqualTo("bob");
        assertThat(ex.getRemoteError()).isNull();
        assertThat(ex.getCause()).isNull();
    }
}
