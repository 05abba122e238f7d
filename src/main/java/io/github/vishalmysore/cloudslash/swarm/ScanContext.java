package io.github.vishalmysore.cloudslash.swarm;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal shared by the scheduler and the tasks it runs.
 * Cancelling stops the control loop and releases idle workers; a task that
 * is already running keeps going until it checks {@link #isCancelled()}.
 */
public class ScanContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Convenience for long-running tasks: throws once the scan is cancelled.
     */
    public void throwIfCancelled() throws InterruptedException {
        if (isCancelled()) {
            throw new InterruptedException("scan cancelled");
        }
    }
}
