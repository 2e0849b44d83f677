package com.phillippitts.peercall.service.signaling.message;

/** {@code call:initiate {to}}. */
public record CallInitiateRequest(String to) { }
