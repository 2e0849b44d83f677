package com.phillippitts.peercall.service.identity.event;

import java.time.Instant;

/**
 * Published when the relay acknowledged the local identity on the current connection.
 */
public record IdentityReattachedEvent(String userId, Instant at) { }
