package com.phillippitts.peercall.service.loop;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Production {@link EventLoop} backed by a single-thread {@link ScheduledExecutorService}.
 *
 * <p>MDC propagation: the submitting thread's Log4j2 ThreadContext is copied into each task so
 * request ids from REST threads survive the hop onto the loop.
 *
 * <p>A task that throws is logged and does not kill the loop thread.
 *
 * @since 1.0
 */
public final class SingleThreadEventLoop implements EventLoop, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(SingleThreadEventLoop.class);

    private final ScheduledExecutorService executor;
    private final Clock clock;
    private volatile Thread loopThread;

    public SingleThreadEventLoop(String threadName, Clock clock) {
        Objects.requireNonNull(threadName, "threadName");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread t = new Thread(runnable, threadName);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        try {
            executor.execute(decorate(task));
        } catch (RejectedExecutionException e) {
            LOG.warn("Event loop is shut down; dropping task");
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task");
        long millis = delay == null ? 0 : Math.max(0, delay.toMillis());
        try {
            ScheduledFuture<?> future = executor.schedule(decorate(task), millis, TimeUnit.MILLISECONDS);
            return new ScheduledTask() {
                @Override
                public boolean cancel() {
                    return future.cancel(false);
                }

                @Override
                public boolean isDone() {
                    return future.isDone();
                }
            };
        } catch (RejectedExecutionException e) {
            LOG.warn("Event loop is shut down; dropping scheduled task");
            return ScheduledTask.NONE;
        }
    }

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable decorate(Runnable task) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            try {
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Unhandled exception on event loop", e);
            } finally {
                ThreadContext.clearAll();
            }
        };
    }
}
