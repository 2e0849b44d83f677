package com.phillippitts.peercall.service.signaling.message;

/** Outbound {@code call:end} and inbound {@code call:ended}: {@code {callId?, roomId?}}. */
public record CallEnd(String callId, String roomId) { }
