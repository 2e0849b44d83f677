package com.phillippitts.peercall.service.identity;

/**
 * Outcome of {@link IdentityReattachment#attach(String, ProfileDelta)}: {@code {ok, userId}} or
 * {@code {ok:false, error}}.
 */
public record AttachResult(boolean ok, String userId, String error) {

    public static AttachResult success(String userId) {
        return new AttachResult(true, userId, null);
    }

    public static AttachResult failure(String error) {
        return new AttachResult(false, null, error);
    }
}
