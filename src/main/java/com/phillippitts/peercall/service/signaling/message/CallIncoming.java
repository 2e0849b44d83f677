package com.phillippitts.peercall.service.signaling.message;

/** {@code call:incoming {callId, from, fromNick?}}. */
public record CallIncoming(String callId, String from, String fromNick) { }
