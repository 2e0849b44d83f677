package com.phillippitts.peercall.service.signaling.message;

/** {@code call:busy {from}}. */
public record CallBusy(String from) { }
