package com.phillippitts.peercall.config.call;

import com.phillippitts.peercall.config.properties.CallProperties;
import com.phillippitts.peercall.config.properties.IdentityProperties;
import com.phillippitts.peercall.config.properties.SignalingProperties;
import com.phillippitts.peercall.config.properties.StoreProperties;
import com.phillippitts.peercall.service.call.CallSessionManager;
import com.phillippitts.peercall.service.call.DisconnectGraceWatcher;
import com.phillippitts.peercall.service.call.NavigationHook;
import com.phillippitts.peercall.service.continuity.ActiveCallRegistry;
import com.phillippitts.peercall.service.continuity.ContinuityBridge;
import com.phillippitts.peercall.service.identity.IdentityReattachment;
import com.phillippitts.peercall.service.ledger.MissedCallLedger;
import com.phillippitts.peercall.service.loop.EventLoop;
import com.phillippitts.peercall.service.matchmaking.MatchmakingSession;
import com.phillippitts.peercall.service.media.MediaCapture;
import com.phillippitts.peercall.service.media.MediaStream;
import com.phillippitts.peercall.service.media.MediaTrack;
import com.phillippitts.peercall.service.media.MediaTransportFactory;
import com.phillippitts.peercall.service.metrics.CallMetrics;
import com.phillippitts.peercall.service.race.RaceGuard;
import com.phillippitts.peercall.service.session.PeerSessionFactory;
import com.phillippitts.peercall.service.session.SignalingOwnershipRegistry;
import com.phillippitts.peercall.service.signaling.DefaultSignalingChannel;
import com.phillippitts.peercall.service.signaling.SignalingChannel;
import com.phillippitts.peercall.service.signaling.transport.SignalingTransport;
import com.phillippitts.peercall.service.signaling.transport.WebSocketSignalingTransport;
import com.phillippitts.peercall.service.store.FileKeyValueStore;
import com.phillippitts.peercall.service.store.InMemoryKeyValueStore;
import com.phillippitts.peercall.service.store.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

/**
 * Wires the call layer explicitly: signaling, identity, race guard, ledger, sessions, the call
 * state machine, continuity and matchmaking.
 *
 * <p>Host-provided collaborators ({@link MediaTransportFactory}, {@link MediaCapture},
 * {@link NavigationHook}, and optionally {@link KeyValueStore}) are looked up lazily. A missing
 * media bean fails the first call that needs media, not startup; a missing navigation hook
 * falls back to {@link NavigationHook#NONE}.
 */
@Configuration
public class CallSessionConfig {

    private static final Logger LOG = LogManager.getLogger(CallSessionConfig.class);

    private final EventLoop loop;
    private final ApplicationEventPublisher publisher;
    private final CallMetrics metrics;

    public CallSessionConfig(EventLoop loop, ApplicationEventPublisher publisher, CallMetrics metrics) {
        this.loop = loop;
        this.publisher = publisher;
        this.metrics = metrics;
    }

    @Bean
    @ConditionalOnMissingBean(KeyValueStore.class)
    public KeyValueStore keyValueStore(StoreProperties props) {
        return switch (props.getType()) {
            case MEMORY -> new InMemoryKeyValueStore();
            case FILE -> new FileKeyValueStore(Path.of(props.getPath()));
        };
    }

    @Bean
    @ConditionalOnMissingBean(SignalingTransport.class)
    public SignalingTransport signalingTransport(SignalingProperties props) {
        return new WebSocketSignalingTransport(new StandardWebSocketClient(), props, loop);
    }

    @Bean
    public SignalingChannel signalingChannel(SignalingTransport transport, SignalingProperties props) {
        return new DefaultSignalingChannel(transport, loop, props, metrics, new Random());
    }

    @Bean
    public IdentityReattachment identityReattachment(SignalingChannel channel,
                                                     KeyValueStore store,
                                                     IdentityProperties props) {
        return new IdentityReattachment(channel, store, loop, publisher, props);
    }

    @Bean
    public RaceGuard raceGuard(CallProperties props) {
        return new RaceGuard(loop.clock(), props.raceGuardTtl());
    }

    @Bean
    public MissedCallLedger missedCallLedger(KeyValueStore store) {
        return new MissedCallLedger(store, publisher, metrics, loop.clock());
    }

    @Bean
    public SignalingOwnershipRegistry signalingOwnershipRegistry(SignalingChannel channel) {
        return new SignalingOwnershipRegistry(channel);
    }

    @Bean
    public PeerSessionFactory peerSessionFactory(SignalingChannel channel,
                                                 SignalingOwnershipRegistry ownershipRegistry,
                                                 ObjectProvider<MediaTransportFactory> transportFactories,
                                                 ObjectProvider<MediaCapture> captures) {
        MediaTransportFactory transports = partnerId -> require(transportFactories, MediaTransportFactory.class)
                .create(partnerId);
        MediaCapture capture = new MediaCapture() {
            @Override
            public CompletableFuture<MediaStream> openLocalStream(boolean withVideo) {
                return require(captures, MediaCapture.class).openLocalStream(withVideo);
            }

            @Override
            public CompletableFuture<MediaTrack> openVideoTrack() {
                return require(captures, MediaCapture.class).openVideoTrack();
            }
        };
        return new PeerSessionFactory(channel, loop, ownershipRegistry, transports, capture);
    }

    @Bean
    public ActiveCallRegistry activeCallRegistry() {
        return new ActiveCallRegistry();
    }

    @Bean
    public ContinuityBridge continuityBridge(ActiveCallRegistry registry,
                                             SignalingChannel channel,
                                             ObjectProvider<NavigationHook> navigation) {
        return new ContinuityBridge(registry, channel, navigation.getIfAvailable(() -> NavigationHook.NONE),
                publisher, loop.clock());
    }

    @Bean(destroyMethod = "shutdown")
    public CallSessionManager callSessionManager(SignalingChannel channel,
                                                 RaceGuard raceGuard,
                                                 MissedCallLedger ledger,
                                                 IdentityReattachment identity,
                                                 PeerSessionFactory sessions,
                                                 ActiveCallRegistry registry,
                                                 ContinuityBridge continuity,
                                                 ObjectProvider<NavigationHook> navigation,
                                                 CallProperties props) {
        return new CallSessionManager(channel, loop, raceGuard, ledger, identity, sessions, registry, continuity,
                navigation.getIfAvailable(() -> NavigationHook.NONE), publisher, metrics, props);
    }

    @Bean(destroyMethod = "shutdown")
    public MatchmakingSession matchmakingSession(SignalingChannel channel, PeerSessionFactory sessions) {
        return new MatchmakingSession(channel, loop, sessions, publisher);
    }

    @Bean
    @ConditionalOnMissingBean(DisconnectGraceWatcher.class)
    public DisconnectGraceWatcher disconnectGraceWatcher(CallSessionManager manager, CallProperties props) {
        return new DisconnectGraceWatcher(manager, loop, props.disconnectGrace());
    }

    /**
     * Connects to the relay once the context is up, when {@code signaling.auto-connect=true}.
     */
    @Bean
    public ApplicationRunner signalingConnector(SignalingChannel channel, SignalingProperties props) {
        return args -> {
            if (props.isAutoConnect()) {
                LOG.info("Auto-connecting signaling channel to {}", props.getUrl());
                channel.connect();
            } else {
                LOG.info("signaling.auto-connect=false; channel stays offline until connect()");
            }
        };
    }

    private static <T> T require(ObjectProvider<T> provider, Class<T> type) {
        T bean = provider.getIfAvailable();
        if (bean == null) {
            throw new IllegalStateException("No " + type.getSimpleName()
                    + " bean: the host application must provide its media stack");
        }
        return bean;
    }
}
