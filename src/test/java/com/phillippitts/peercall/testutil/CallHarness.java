package com.phillippitts.peercall.testutil;

import com.phillippitts.peercall.config.properties.CallProperties;
import com.phillippitts.peercall.config.properties.IdentityProperties;
import com.phillippitts.peercall.config.properties.SignalingProperties;
import com.phillippitts.peercall.service.call.CallSessionManager;
import com.phillippitts.peercall.service.continuity.ActiveCallRegistry;
import com.phillippitts.peercall.service.continuity.ContinuityBridge;
import com.phillippitts.peercall.service.identity.IdentityReattachment;
import com.phillippitts.peercall.service.ledger.MissedCallLedger;
import com.phillippitts.peercall.service.media.TransportState;
import com.phillippitts.peercall.service.metrics.CallMetrics;
import com.phillippitts.peercall.service.race.RaceGuard;
import com.phillippitts.peercall.service.session.PeerSessionFactory;
import com.phillippitts.peercall.service.session.SignalingOwnershipRegistry;
import com.phillippitts.peercall.service.signaling.DefaultSignalingChannel;
import com.phillippitts.peercall.service.store.InMemoryKeyValueStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;

import java.util.Random;

/**
 * The whole call stack wired over fakes: virtual-time loop, in-memory relay, fake media.
 *
 * <p>The local user is {@value #SELF}; it has a stored identity, so {@link #trusted()} only has to
 * connect and acknowledge the reauth.
 */
public class CallHarness {

    public static final String SELF = "alice";

    public final ManualEventLoop loop = new ManualEventLoop();
    public final FakeSignalingTransport transport = new FakeSignalingTransport();
    public final SignalingProperties signalingProps = new SignalingProperties();
    public final CallProperties callProps = new CallProperties();
    public final CallMetrics metrics = new CallMetrics(new SimpleMeterRegistry());
    public final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
    public final EventCapturingPublisher publisher = new EventCapturingPublisher();
    public final FakeMediaTransportFactory media = new FakeMediaTransportFactory();
    public final FakeMediaCapture capture = new FakeMediaCapture();
    public final RecordingNavigationHook navigation = new RecordingNavigationHook();
    public final ActiveCallRegistry activeCalls = new ActiveCallRegistry();

    public final DefaultSignalingChannel channel;
    public final IdentityReattachment identity;
    public final RaceGuard raceGuard;
    public final MissedCallLedger ledger;
    public final PeerSessionFactory sessions;
    public final ContinuityBridge continuity;
    public final CallSessionManager calls;

    public CallHarness() {
        store.put(IdentityReattachment.USER_ID_KEY, SELF);
        channel = new DefaultSignalingChannel(transport, loop, signalingProps, metrics, new Random(5));
        identity = new IdentityReattachment(channel, store, loop, publisher,
                new IdentityProperties("install-" + SELF, SELF, false));
        raceGuard = new RaceGuard(loop.clock(), callProps.raceGuardTtl());
        ledger = new MissedCallLedger(store, publisher, metrics, loop.clock());
        sessions = new PeerSessionFactory(channel, loop, new SignalingOwnershipRegistry(channel), media, capture);
        continuity = new ContinuityBridge(activeCalls, channel, navigation, publisher, loop.clock());
        calls = new CallSessionManager(channel, loop, raceGuard, ledger, identity, sessions, activeCalls,
                continuity, navigation, publisher, metrics, callProps);
    }

    /** Connects the relay and acknowledges the identity reauth. */
    public CallHarness trusted() {
        transport.simulateConnected();
        transport.lastEmitted("reauth").orElseThrow()
                .ack(new JSONObject().put("ok", true).put("userId", SELF));
        transport.clearEmitted();
        return this;
    }

    public void inbound(String event, JSONObject data) {
        transport.simulateEvent(event, data);
    }

    /** Acknowledges the most recent {@code event} frame. */
    public void ackLast(String event, JSONObject response) {
        transport.lastEmitted(event).orElseThrow().ack(response);
    }

    /** Places a call to {@code peerId} and lets the relay issue {@code callId}. */
    public void ringOut(String peerId, String callId) {
        calls.initiateCall(peerId);
        ackLast("call:initiate", new JSONObject().put("ok", true).put("callId", callId));
    }

    public void incoming(String callId, String from) {
        inbound("call:incoming", new JSONObject().put("callId", callId).put("from", from).put("fromNick", from.toUpperCase()));
    }

    /** Drives an outgoing call all the way to ACTIVE. */
    public void activeOutgoing(String peerId, String callId) {
        ringOut(peerId, callId);
        inbound("call:accepted", new JSONObject().put("callId", callId).put("from", peerId));
        media.last().fireState(TransportState.CONNECTED);
    }
}
