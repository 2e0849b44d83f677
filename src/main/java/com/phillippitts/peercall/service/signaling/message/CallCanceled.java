package com.phillippitts.peercall.service.signaling.message;

/** Inbound {@code call:cancel {callId, from}}. */
public record CallCanceled(String callId, String from) { }
