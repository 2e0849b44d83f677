package com.phillippitts.peercall.service.health;

import com.phillippitts.peercall.service.identity.IdentityReattachment;
import com.phillippitts.peercall.service.identity.TrustState;
import com.phillippitts.peercall.service.signaling.SignalingChannel;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the signaling channel and identity.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: channel connected and identity trusted</li>
 *   <li>DEGRADED: channel connected, identity pending or failed (calls cannot be placed)</li>
 *   <li>DOWN: channel offline</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SignalingHealthIndicator implements HealthIndicator {

    private final SignalingChannel channel;
    private final IdentityReattachment identity;

    public SignalingHealthIndicator(SignalingChannel channel, IdentityReattachment identity) {
        this.channel = channel;
        this.identity = identity;
    }

    @Override
    public Health health() {
        boolean connected = channel.isConnected();
        TrustState trust = identity.trustState();

        Health.Builder builder = new Health.Builder();
        if (connected && trust == TrustState.TRUSTED) {
            builder.up().withDetail("status", "Signaling connected, identity trusted");
        } else if (connected) {
            builder.status("DEGRADED").withDetail("status", "Signaling connected, identity not trusted");
        } else {
            builder.down().withDetail("status", "Signaling offline");
        }
        return builder
                .withDetail("connectionId", channel.sessionId().orElse("none"))
                .withDetail("identity", trust.name())
                .build();
    }
}
