package com.phillippitts.peercall.service.signaling.message;

/** {@code call:room_full {userId?}}. */
public record CallRoomFull(String userId) { }
