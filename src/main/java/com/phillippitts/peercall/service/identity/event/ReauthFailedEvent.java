package com.phillippitts.peercall.service.identity.event;

import java.time.Instant;

/**
 * Published when reauth after a reconnect was rejected or never acknowledged. Call initiation
 * stays refused until a later reauth or attach succeeds.
 */
public record ReauthFailedEvent(String userId, String error, Instant at) { }
