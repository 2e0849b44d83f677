package com.phillippitts.peercall.service.signaling;

import com.phillippitts.peercall.service.loop.ScheduledTask;
import org.json.JSONObject;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One acknowledgement attempt. Resolution and timeout race for a single flag, so exactly one of
 * them completes the future and each fires at most once.
 */
final class PendingAck {

    private final AtomicBoolean settled = new AtomicBoolean(false);
    private final CompletableFuture<JSONObject> future = new CompletableFuture<>();
    private volatile ScheduledTask timer = ScheduledTask.NONE;

    CompletableFuture<JSONObject> future() {
        return future;
    }

    void armTimer(ScheduledTask timer) {
        this.timer = timer;
        if (settled.get()) {
            timer.cancel();
        }
    }

    boolean resolve(JSONObject data) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        timer.cancel();
        future.complete(data);
        return true;
    }

    boolean timeOut(String eventName) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        future.completeExceptionally(new TimeoutException("Ack timeout for \"" + eventName + "\""));
        return true;
    }

    boolean fail(Throwable cause) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        timer.cancel();
        future.completeExceptionally(cause);
        return true;
    }

    boolean isSettled() {
        return settled.get();
    }
}
