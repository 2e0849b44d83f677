package com.phillippitts.peercall.service.continuity;

import com.phillippitts.peercall.service.call.CallRecord;
import com.phillippitts.peercall.service.signaling.Subscription;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ActiveCallRegistryTest {

    private final ActiveCallRegistry registry = new ActiveCallRegistry();

    @Test
    void lookupReturnsLiveControls() {
        StubControls controls = new StubControls("c-1");
        registry.register(controls);

        assertThat(registry.lookup("c-1")).containsSame(controls);
        assertThat(registry.current()).containsSame(controls);
    }

    @Test
    void staleControlsAreDroppedOnLookup() {
        StubControls controls = new StubControls("c-1");
        registry.register(controls);
        controls.live = false;

        assertThat(registry.lookup("c-1")).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void cancellingAnOldRegistrationKeepsTheNewerOne() {
        Subscription first = registry.register(new StubControls("c-1"));
        StubControls second = new StubControls("c-1");
        registry.register(second);

        first.cancel();

        assertThat(registry.lookup("c-1")).containsSame(second);
    }

    @Test
    void nullKeyFindsNothing() {
        assertThat(registry.lookup(null)).isEmpty();
    }

    private static final class StubControls implements CallControls {
        private final String key;
        boolean live = true;

        StubControls(String key) {
            this.key = key;
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public CallRecord record() {
            return CallRecord.incoming(key, "bob", null, Instant.EPOCH);
        }

        @Override
        public boolean isLive() {
            return live;
        }

        @Override
        public CompletableFuture<Boolean> toggleMic() {
            return CompletableFuture.completedFuture(false);
        }

        @Override
        public CompletableFuture<Boolean> toggleRemoteAudio() {
            return CompletableFuture.completedFuture(false);
        }

        @Override
        public CompletableFuture<Void> hangup() {
            return CompletableFuture.completedFuture(null);
        }
    }
}
