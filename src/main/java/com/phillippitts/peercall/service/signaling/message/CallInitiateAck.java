package com.phillippitts.peercall.service.signaling.message;

/** Acknowledgement of {@code call:initiate}: {@code {ok, callId}} or {@code {ok:false, error}}. */
public record CallInitiateAck(boolean ok, String callId, String error) { }
