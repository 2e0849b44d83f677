package com.phillippitts.peercall.service.signaling.message;

/** {@code call:timeout {callId}}. */
public record CallTimedOut(String callId) { }
