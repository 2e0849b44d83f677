package com.phillippitts.peercall.service.signaling.message;

/** Acknowledgement of {@code identity:attach} and {@code reauth}. */
public record IdentityAck(boolean ok, String userId, String error) { }
