package com.phillippitts.peercall.service.signaling.message;

/** {@code reauth {userId}}. */
public record Reauth(String userId) { }
