package com.phillippitts.peercall.service.session;

import com.phillippitts.peercall.config.properties.SignalingProperties;
import com.phillippitts.peercall.service.metrics.CallMetrics;
import com.phillippitts.peercall.service.signaling.DefaultSignalingChannel;
import com.phillippitts.peercall.service.signaling.SignalingEvents;
import com.phillippitts.peercall.service.signaling.message.DescriptionMessage;
import com.phillippitts.peercall.service.signaling.message.IceCandidateMessage;
import com.phillippitts.peercall.testutil.FakeSignalingTransport;
import com.phillippitts.peercall.testutil.ManualEventLoop;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class SignalingOwnershipRegistryTest {

    private FakeSignalingTransport transport;
    private DefaultSignalingChannel channel;
    private SignalingOwnershipRegistry registry;

    @BeforeEach
    void setUp() {
        transport = new FakeSignalingTransport();
        channel = new DefaultSignalingChannel(transport, new ManualEventLoop(), new SignalingProperties(),
                new CallMetrics(new SimpleMeterRegistry()), new Random(3));
        registry = new SignalingOwnershipRegistry(channel);
        transport.simulateConnected();
    }

    @Test
    void onlyOneHolderIsBoundToNegotiationEvents() {
        RecordingHandler direct = new RecordingHandler();
        RecordingHandler matchmaking = new RecordingHandler();

        Optional<SignalingOwnership> first = registry.acquire(SessionType.DIRECT, direct);
        assertThat(first).isPresent();
        assertThat(channel.listenerCount(SignalingEvents.OFFER)).isEqualTo(1);

        Optional<SignalingOwnership> second = registry.acquire(SessionType.MATCHMAKING, matchmaking);
        assertThat(second).isEmpty();
        assertThat(channel.listenerCount(SignalingEvents.OFFER)).isEqualTo(1);
        assertThat(registry.holder()).contains(SessionType.DIRECT);

        transport.simulateEvent("offer", new JSONObject().put("from", "bob")
                .put("offer", new JSONObject().put("type", "offer").put("sdp", "v=0")));
        assertThat(direct.offers).hasSize(1);
        assertThat(matchmaking.offers).isEmpty();

        first.get().release();
        assertThat(channel.listenerCount(SignalingEvents.OFFER)).isZero();
        assertThat(channel.listenerCount(SignalingEvents.ANSWER)).isZero();
        assertThat(channel.listenerCount(SignalingEvents.ICE_CANDIDATE)).isZero();
        assertThat(registry.holder()).isEmpty();

        first.get().release();
        assertThat(channel.listenerCount(SignalingEvents.OFFER)).isZero();
        assertThat(first.get().isReleased()).isTrue();
    }

    @Test
    void ownershipCanBeReacquiredAfterRelease() {
        registry.acquire(SessionType.MATCHMAKING, new RecordingHandler()).orElseThrow().release();

        Optional<SignalingOwnership> next = registry.acquire(SessionType.DIRECT, new RecordingHandler());

        assertThat(next).isPresent();
        assertThat(next.get().sessionType()).isEqualTo(SessionType.DIRECT);
        assertThat(channel.listenerCount(SignalingEvents.OFFER)).isEqualTo(1);
    }

    @Test
    void refusalHolds() {
        registry.acquire(SessionType.MATCHMAKING, new RecordingHandler());

        assertThat(registry.acquire(SessionType.MATCHMAKING, new RecordingHandler())).isEmpty();
        assertThat(registry.acquire(SessionType.DIRECT, new RecordingHandler())).isEmpty();
        assertThat(registry.holder()).contains(SessionType.MATCHMAKING);
    }

    private static final class RecordingHandler implements NegotiationHandler {
        final List<DescriptionMessage> offers = new ArrayList<>();

        @Override
        public void onOffer(DescriptionMessage message) {
            offers.add(message);
        }

        @Override
        public void onAnswer(DescriptionMessage message) {
        }

        @Override
        public void onIceCandidate(IceCandidateMessage message) {
        }
    }
}
