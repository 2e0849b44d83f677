package com.phillippitts.peercall.service.continuity;

/**
 * What the picture-in-picture surface shows about the other party.
 */
public record PartnerMeta(String peerId, String nick) { }
