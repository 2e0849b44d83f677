package com.phillippitts.peercall.service.health;

import com.phillippitts.peercall.service.identity.IdentityReattachment;
import com.phillippitts.peercall.service.identity.TrustState;
import com.phillippitts.peercall.service.signaling.SignalingChannel;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignalingHealthIndicatorTest {

    private final SignalingChannel channel = mock(SignalingChannel.class);
    private final IdentityReattachment identity = mock(IdentityReattachment.class);
    private final SignalingHealthIndicator indicator = new SignalingHealthIndicator(channel, identity);

    @Test
    void shouldReportUpWhenConnectedAndTrusted() {
        when(channel.isConnected()).thenReturn(true);
        when(channel.sessionId()).thenReturn(Optional.of("conn-1"));
        when(identity.trustState()).thenReturn(TrustState.TRUSTED);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("connectionId", "conn-1");
        assertThat(health.getDetails()).containsEntry("identity", "TRUSTED");
    }

    @Test
    void shouldReportDegradedWhileReauthPending() {
        when(channel.isConnected()).thenReturn(true);
        when(channel.sessionId()).thenReturn(Optional.of("conn-1"));
        when(identity.trustState()).thenReturn(TrustState.PENDING);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Signaling connected, identity not trusted");
    }

    @Test
    void shouldReportDownWhenOffline() {
        when(channel.isConnected()).thenReturn(false);
        when(channel.sessionId()).thenReturn(Optional.empty());
        when(identity.trustState()).thenReturn(TrustState.PENDING);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("connectionId", "none");
    }
}
