package com.phillippitts.peercall.service.identity;

import com.phillippitts.peercall.config.properties.IdentityProperties;
import com.phillippitts.peercall.config.properties.SignalingProperties;
import com.phillippitts.peercall.service.identity.event.IdentityReattachedEvent;
import com.phillippitts.peercall.service.identity.event.ReauthFailedEvent;
import com.phillippitts.peercall.service.metrics.CallMetrics;
import com.phillippitts.peercall.service.signaling.DefaultSignalingChannel;
import com.phillippitts.peercall.service.store.InMemoryKeyValueStore;
import com.phillippitts.peercall.service.store.KeyValueStore;
import com.phillippitts.peercall.testutil.EventCapturingPublisher;
import com.phillippitts.peercall.testutil.FakeSignalingTransport;
import com.phillippitts.peercall.testutil.ManualEventLoop;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class IdentityReattachmentTest {

    private ManualEventLoop loop;
    private FakeSignalingTransport transport;
    private DefaultSignalingChannel channel;
    private KeyValueStore store;
    private EventCapturingPublisher publisher;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        transport = new FakeSignalingTransport();
        SignalingProperties props = new SignalingProperties();
        props.setRetries(0);
        channel = new DefaultSignalingChannel(transport, loop, props, new CallMetrics(new SimpleMeterRegistry()), new Random(1));
        store = new InMemoryKeyValueStore();
        publisher = new EventCapturingPublisher();
    }

    private IdentityReattachment identity(boolean attachOnConnect) {
        return new IdentityReattachment(channel, store, loop, publisher,
                new IdentityProperties("install-1", "Neo", attachOnConnect));
    }

    @Test
    void concurrentAttachCallsShareOneRequest() {
        IdentityReattachment identity = identity(false);
        transport.simulateConnected();

        List<CompletableFuture<AttachResult>> calls = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            calls.add(identity.attach("install-1", ProfileDelta.empty()));
        }

        assertThat(transport.emitted("identity:attach")).hasSize(1);
        transport.emitted("identity:attach").get(0).ack(new JSONObject().put("ok", true).put("userId", "u-1"));

        assertThat(calls).allSatisfy(f -> assertThat(f.join()).isEqualTo(AttachResult.success("u-1")));
        assertThat(store.get(IdentityReattachment.USER_ID_KEY)).contains("u-1");
        assertThat(identity.trustState()).isEqualTo(TrustState.TRUSTED);
        assertThat(channel.sessionUserId()).contains("u-1");
        assertThat(publisher.eventsOf(IdentityReattachedEvent.class)).hasSize(1);
    }

    @Test
    void attachAfterCompletionSendsAFreshRequest() {
        IdentityReattachment identity = identity(false);
        transport.simulateConnected();

        identity.attach("install-1", null);
        transport.emitted("identity:attach").get(0).ack(new JSONObject().put("ok", false).put("error", "rate_limited"));
        identity.attach("install-1", null);

        assertThat(transport.emitted("identity:attach")).hasSize(2);
    }

    @Test
    void rejectedAttachResolvesWithRelayError() {
        IdentityReattachment identity = identity(false);
        transport.simulateConnected();

        CompletableFuture<AttachResult> result = identity.attach("install-1", new ProfileDelta("Neo", null));
        JSONObject sent = transport.emitted("identity:attach").get(0).data();
        transport.emitted("identity:attach").get(0).ack(new JSONObject().put("ok", false).put("error", "banned"));

        assertThat(sent.getString("installId")).isEqualTo("install-1");
        assertThat(sent.getJSONObject("profile").getString("nick")).isEqualTo("Neo");
        assertThat(result.join()).isEqualTo(AttachResult.failure("banned"));
        assertThat(identity.trustState()).isEqualTo(TrustState.UNKNOWN);
        assertThat(store.get(IdentityReattachment.USER_ID_KEY)).isEmpty();
    }

    @Test
    void attachWhileOfflineResolvesAsFailureInsteadOfThrowing() {
        IdentityReattachment identity = identity(false);

        CompletableFuture<AttachResult> result = identity.attach("install-1", null);
        loop.advanceMillis(new SignalingProperties().getConnectWaitMs());

        assertThat(result.join().ok()).isFalse();
        assertThat(result.join().error()).isEqualTo("OFFLINE");
    }

    @Test
    void attachesOnFirstConnectWhenNoUserIsKnown() {
        identity(true);

        transport.simulateConnected();

        assertThat(transport.emitted("identity:attach")).hasSize(1);
        assertThat(transport.emitted("identity:attach").get(0).data().getString("installId")).isEqualTo("install-1");
    }

    @Test
    void reconnectWithKnownUserReauthsAndTrustsOnlyAfterAck() {
        store.put(IdentityReattachment.USER_ID_KEY, "u-7");
        IdentityReattachment identity = identity(true);
        assertThat(identity.trustState()).isEqualTo(TrustState.PENDING);

        transport.simulateConnected();

        assertThat(transport.emitted("identity:attach")).isEmpty();
        assertThat(transport.emitted("reauth")).hasSize(1);
        assertThat(transport.emitted("reauth").get(0).data().getString("userId")).isEqualTo("u-7");
        assertThat(identity.isTrusted()).isFalse();

        transport.emitted("reauth").get(0).ack(new JSONObject().put("ok", true).put("userId", "u-7"));

        assertThat(identity.trustState()).isEqualTo(TrustState.TRUSTED);
        assertThat(channel.sessionUserId()).contains("u-7");
        assertThat(publisher.lastOf(IdentityReattachedEvent.class).userId()).isEqualTo("u-7");
    }

    @Test
    void rejectedReauthMarksTrustFailed() {
        store.put(IdentityReattachment.USER_ID_KEY, "u-7");
        IdentityReattachment identity = identity(false);

        transport.simulateConnected();
        transport.emitted("reauth").get(0).ack(new JSONObject().put("ok", false).put("error", "unknown_user"));

        assertThat(identity.trustState()).isEqualTo(TrustState.FAILED);
        ReauthFailedEvent failed = publisher.lastOf(ReauthFailedEvent.class);
        assertThat(failed.userId()).isEqualTo("u-7");
        assertThat(failed.error()).isEqualTo("unknown_user");
    }

    @Test
    void disconnectSuspendsTrustUntilNextReauth() {
        store.put(IdentityReattachment.USER_ID_KEY, "u-7");
        IdentityReattachment identity = identity(false);
        transport.simulateConnected();
        transport.emitted("reauth").get(0).ack(new JSONObject().put("ok", true));
        assertThat(identity.isTrusted()).isTrue();

        transport.simulateDisconnected("io error", true);
        assertThat(identity.trustState()).isEqualTo(TrustState.PENDING);

        transport.simulateConnected();
        assertThat(transport.emitted("reauth")).hasSize(2);
        assertThat(identity.trustState()).isEqualTo(TrustState.PENDING);
    }

    @Test
    void generatedInstallIdIsPersistedAndStable() {
        IdentityReattachment identity = new IdentityReattachment(channel, store, loop, publisher,
                new IdentityProperties(null, null, false));

        String first = identity.installId();

        assertThat(first).isNotBlank();
        assertThat(identity.installId()).isEqualTo(first);
        assertThat(store.get(IdentityReattachment.INSTALL_ID_KEY)).contains(first);
    }
}
