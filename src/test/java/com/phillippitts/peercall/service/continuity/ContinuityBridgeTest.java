package com.phillippitts.peercall.service.continuity;

import com.phillippitts.peercall.service.call.CallState;
import com.phillippitts.peercall.service.continuity.event.ContinuityStateEvent;
import com.phillippitts.peercall.testutil.CallHarness;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ContinuityBridgeTest {

    private CallHarness h;
    private ContinuityBridge bridge;

    @BeforeEach
    void setUp() {
        h = new CallHarness().trusted();
        bridge = h.continuity;
    }

    @Test
    void enterIsRefusedWithoutAnActiveCall() {
        assertThat(bridge.enter(null, "c-1")).isFalse();

        h.ringOut("bob", "c-1");
        assertThat(bridge.enter(null, "c-1")).isFalse();
        assertThat(bridge.isActive()).isFalse();
    }

    @Test
    void enterAnnouncesPipToPartner() {
        h.activeOutgoing("bob", "c-1");

        assertThat(bridge.enter(null, "c-1")).isTrue();

        JSONObject sent = h.transport.lastEmitted("pip:state").orElseThrow().data();
        assertThat(sent.getBoolean("inPiP")).isTrue();
        assertThat(sent.getString("to")).isEqualTo("bob");
        assertThat(sent.getString("roomId")).isEqualTo("room_alice_bob");
        assertThat(bridge.partner()).contains(new PartnerMeta("bob", null));
        assertThat(bridge.callKey()).contains("c-1");
        assertThat(h.publisher.lastOf(ContinuityStateEvent.class).inPiP()).isTrue();
    }

    @Test
    void enteringTwiceIsIdempotent() {
        h.activeOutgoing("bob", "c-1");

        bridge.enter(new PartnerMeta("bob", "Bobby"), "c-1");
        bridge.enter(null, "c-1");

        assertThat(h.transport.emitted("pip:state")).hasSize(1);
        assertThat(bridge.partner().orElseThrow().nick()).isEqualTo("Bobby");
    }

    @Test
    void controlsReachTheLiveCall() {
        h.activeOutgoing("bob", "c-1");
        bridge.enter(null, "c-1");

        assertThat(bridge.toggleMic().join()).contains(false);
        assertThat(bridge.toggleRemoteAudio().join()).contains(false);
        assertThat(h.calls.peerSession().orElseThrow().isMicEnabled()).isFalse();
    }

    @Test
    void endCallHangsUpOnceAndExits() {
        h.activeOutgoing("bob", "c-1");
        bridge.enter(null, "c-1");

        bridge.endCall().join();
        bridge.endCall().join();

        assertThat(h.calls.state()).isEqualTo(CallState.IDLE);
        assertThat(h.transport.emitted("call:end")).hasSize(1);
        assertThat(bridge.isActive()).isFalse();
    }

    @Test
    void returnToCallNavigatesAndAnnouncesExit() {
        h.activeOutgoing("bob", "c-1");
        bridge.enter(null, "c-1");

        assertThat(bridge.returnToCall()).isTrue();

        assertThat(h.navigation.returned).hasSize(1);
        assertThat(bridge.isActive()).isFalse();
        assertThat(h.transport.lastEmitted("pip:state").orElseThrow().data().getBoolean("inPiP")).isFalse();
        assertThat(h.calls.state()).isEqualTo(CallState.ACTIVE);
    }

    @Test
    void callEndingElsewhereTearsDownTheBridge() {
        h.activeOutgoing("bob", "c-1");
        bridge.enter(null, "c-1");

        h.inbound("call:ended", new JSONObject().put("callId", "c-1"));

        assertThat(bridge.isActive()).isFalse();
        assertThat(bridge.toggleMic().join()).isEqualTo(Optional.empty());
        assertThat(h.transport.emitted("pip:state")).hasSize(2);
        JSONObject closing = h.transport.lastEmitted("pip:state").orElseThrow().data();
        assertThat(closing.getBoolean("inPiP")).isFalse();
        assertThat(closing.getString("to")).isEqualTo("bob");
        assertThat(closing.getString("roomId")).isEqualTo("room_alice_bob");
    }

    @Test
    void exitingTheBridgeNeverEndsTheCall() {
        h.activeOutgoing("bob", "c-1");
        bridge.enter(null, "c-1");

        bridge.exit();
        bridge.exit();

        assertThat(h.calls.state()).isEqualTo(CallState.ACTIVE);
        assertThat(h.transport.emitted("pip:state")).hasSize(2);
    }

    @Test
    void partnerPipStateIsPublished() {
        h.inbound("pip:state", new JSONObject().put("inPiP", true).put("from", "bob").put("roomId", "room_alice_bob"));

        ContinuityStateEvent event = h.publisher.lastOf(ContinuityStateEvent.class);
        assertThat(event.local()).isFalse();
        assertThat(event.inPiP()).isTrue();
        assertThat(event.peerId()).isEqualTo("bob");
    }
}
