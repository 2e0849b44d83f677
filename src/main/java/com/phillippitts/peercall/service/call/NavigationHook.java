package com.phillippitts.peercall.service.call;

/**
 * Host-provided navigation driven by call transitions. Invoked on the event loop.
 */
public interface NavigationHook {

    /** Does nothing and reports {@link ScreenPresence#UNKNOWN}. */
    NavigationHook NONE = new NavigationHook() {
        @Override
        public void onCallActive(CallRecord record) {
        }

        @Override
        public void onCallIdle(CallRecord last) {
        }

        @Override
        public void returnToCall(CallRecord record) {
        }

        @Override
        public ScreenPresence screenPresence() {
            return ScreenPresence.UNKNOWN;
        }
    };

    /** Navigate to the call screen. */
    void onCallActive(CallRecord record);

    /** The call is over; {@code last} is the final record. */
    void onCallIdle(CallRecord last);

    /** Bring the call screen back from picture-in-picture. */
    void returnToCall(CallRecord record);

    ScreenPresence screenPresence();
}
