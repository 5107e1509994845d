package tw.gc.strategy.optimizer.services.execution;

/**
 * Receives progress after every completed trial, in completion order, on the thread driving the search.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param completed Trials finished so far
     * @param total Expected number of trials, or null when unknown (time-budgeted adaptive search)
     */
    void onProgress(int completed, Integer total);

    static ProgressListener none() {
        return (completed, total) -> { };
    }

    /**
     * Shifts counts by a fixed offset against a fixed overall total.
     * Used when one run chains several scheduled batches.
     */
    default ProgressListener offset(int completedBefore, Integer overallTotal) {
        ProgressListener delegate = this;
        return (completed, total) -> delegate.onProgress(completedBefore + completed, overallTotal);
    }
}
