package com.phillippitts.peercall.service.signaling.message;

/** {@code call:declined {callId, from}}. */
public record CallDeclined(String callId, String from) { }
