package com.phillippitts.peercall.service.signaling.message;

/** Out-of-band {@code cam-toggle {roomId, enabled}}; {@code to}/{@code from} address the partner. */
public record CameraToggle(String roomId, boolean enabled, String to, String from) { }
