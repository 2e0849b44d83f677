package com.phillippitts.peercall.service.loop;

/**
 * Cancellable handle for a task scheduled on an {@link EventLoop}.
 */
public interface ScheduledTask {

    /** A handle that is already finished; cancelling it does nothing. */
    ScheduledTask NONE = new ScheduledTask() {
        @Override
        public boolean cancel() {
            return false;
        }

        @Override
        public boolean isDone() {
            return true;
        }
    };

    /**
     * Cancels the task.
     *
     * @return {@code true} if the task was prevented from running
     */
    boolean cancel();

    /**
     * @return {@code true} once the task has run or was cancelled
     */
    boolean isDone();
}
