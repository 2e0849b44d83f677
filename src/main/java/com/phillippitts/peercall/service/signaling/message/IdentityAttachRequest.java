package com.phillippitts.peercall.service.signaling.message;

/**
 * {@code identity:attach {installId, profile}}.
 *
 * @param installId stable installation id
 * @param nick optional nickname
 * @param avatarUrl optional avatar reference
 */
public record IdentityAttachRequest(String installId, String nick, String avatarUrl) { }
