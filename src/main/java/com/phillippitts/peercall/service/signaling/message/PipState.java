package com.phillippitts.peercall.service.signaling.message;

/** {@code pip:state {inPiP, roomId, to}}; inbound copies carry {@code from}. */
public record PipState(boolean inPiP, String roomId, String to, String from) { }
