package com.phillippitts.peercall.service.loop;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * The single logical thread that processes inbound signaling events, UI intents and local
 * timeouts.
 *
 * <p>Tasks submitted through {@link #execute(Runnable)} run one at a time in submission order.
 * Nothing running on the loop may block; suspending work completes a future whose continuation
 * is scheduled back onto the loop.
 *
 * @since 1.0
 */
public interface EventLoop extends Executor {

    /**
     * Schedules a task to run on the loop after the given delay.
     *
     * @param task task to run
     * @param delay delay before the task runs (zero or negative runs it as soon as possible)
     * @return handle that cancels the task if it has not started yet
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Clock used for all time-based decisions made on the loop (race-guard eviction, record
     * timestamps). Tests substitute a virtual clock.
     */
    Clock clock();

    /**
     * Returns {@code true} when the calling thread is the loop thread.
     */
    boolean inEventLoop();
}
