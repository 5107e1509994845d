package tw.gc.strategy.optimizer.services.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag passed down from the caller to the scheduler.
 * It is only checked between trial submissions; a running evaluation is never interrupted by it.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return a fresh token nobody else holds, so it is never cancelled
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
