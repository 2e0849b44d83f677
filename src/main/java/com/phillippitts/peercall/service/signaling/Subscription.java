package com.phillippitts.peercall.service.signaling;

/**
 * Handle returned by handler registration; {@link #cancel()} is the typed equivalent of
 * {@code off(event, handler)} and may be called any number of times.
 */
@FunctionalInterface
public interface Subscription {

    Subscription NONE = () -> { };

    void cancel();
}
