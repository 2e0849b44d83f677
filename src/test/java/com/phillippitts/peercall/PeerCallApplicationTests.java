package com.phillippitts.peercall;

import com.phillippitts.peercall.service.call.CallSessionManager;
import com.phillippitts.peercall.service.call.CallState;
import com.phillippitts.peercall.service.health.SignalingHealthIndicator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest(
    properties = {
        "signaling.auto-connect=false", // no relay in tests
        "store.type=MEMORY"
    }
)
class PeerCallApplicationTests {

    @Autowired
    private CallSessionManager calls;

    @Autowired
    private SignalingHealthIndicator health;

    @Test
    void contextLoadsIdleAndOffline() {
        assertThat(calls.state()).isEqualTo(CallState.IDLE);
        assertThat(health.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
