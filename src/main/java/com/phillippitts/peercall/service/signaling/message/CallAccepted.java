package com.phillippitts.peercall.service.signaling.message;

/** {@code call:accepted {callId, from, roomId?}}. */
public record CallAccepted(String callId, String from, String roomId) { }
