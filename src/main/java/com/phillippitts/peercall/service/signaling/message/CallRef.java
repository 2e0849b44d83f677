package com.phillippitts.peercall.service.signaling.message;

/** Outbound {@code call:accept}, {@code call:decline} and {@code call:cancel} carry only the call id. */
public record CallRef(String callId) { }
