package com.phillippitts.peercall.service.call;

import com.phillippitts.peercall.service.call.event.CallStateChangedEvent;
import com.phillippitts.peercall.service.call.event.RemoteDisconnectedEvent;
import com.phillippitts.peercall.service.call.event.RemoteReconnectedEvent;
import com.phillippitts.peercall.service.media.TransportState;
import com.phillippitts.peercall.testutil.CallHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DisconnectGraceWatcherTest {

    private CallHarness h;
    private DisconnectGraceWatcher watcher;

    @BeforeEach
    void setUp() {
        h = new CallHarness().trusted();
        watcher = new DisconnectGraceWatcher(h.calls, h.loop, Duration.ofMillis(8000));
        h.activeOutgoing("bob", "c-1");
    }

    @Test
    void hangsUpWhenMediaDoesNotRecover() {
        dropMedia();

        h.loop.advanceMillis(7999);
        assertThat(h.calls.state()).isEqualTo(CallState.ACTIVE);

        h.loop.advanceMillis(1);
        assertThat(h.calls.state()).isEqualTo(CallState.IDLE);
        assertThat(h.transport.emitted("call:end")).hasSize(1);
        assertThat(watcher.isPending()).isFalse();
    }

    @Test
    void recoveryWithinGraceKeepsTheCall() {
        dropMedia();

        h.media.last().fireState(TransportState.CONNECTED);
        watcher.onRemoteReconnected(h.publisher.lastOf(RemoteReconnectedEvent.class));
        h.loop.advanceMillis(10_000);

        assertThat(watcher.isPending()).isFalse();
        assertThat(h.calls.state()).isEqualTo(CallState.ACTIVE);
    }

    @Test
    void callEndingClearsThePendingHangup() {
        dropMedia();

        h.calls.hangup().join();
        watcher.onCallStateChanged(h.publisher.lastOf(CallStateChangedEvent.class));

        assertThat(watcher.isPending()).isFalse();
        h.loop.advanceMillis(10_000);
        assertThat(h.transport.emitted("call:end")).hasSize(1);
    }

    @Test
    void expiryLeavesADifferentCallAlone() {
        dropMedia();
        h.calls.hangup().join();
        h.activeOutgoing("carol", "c-2");

        h.loop.advanceMillis(8000);

        assertThat(h.calls.currentRecord().orElseThrow().callId()).isEqualTo("c-2");
        assertThat(h.calls.state()).isEqualTo(CallState.ACTIVE);
    }

    private void dropMedia() {
        h.media.last().fireState(TransportState.DISCONNECTED);
        watcher.onRemoteDisconnected(h.publisher.lastOf(RemoteDisconnectedEvent.class));
        assertThat(watcher.isPending()).isTrue();
    }
}
