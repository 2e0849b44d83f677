package com.phillippitts.peercall.service.call;

/**
 * Where the host UI currently is, as far as the call layer can tell.
 */
public enum ScreenPresence {
    ON_CALL_SCREEN,
    ELSEWHERE,
    /** Navigation not ready or not reported. Treated like {@link #ELSEWHERE}. */
    UNKNOWN
}
