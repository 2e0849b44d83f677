package com.phillippitts.peercall.service.identity;

/**
 * Profile fields sent with {@code identity:attach}. Either may be {@code null}.
 */
public record ProfileDelta(String nick, String avatarUrl) {

    public static ProfileDelta empty() {
        return new ProfileDelta(null, null);
    }
}
