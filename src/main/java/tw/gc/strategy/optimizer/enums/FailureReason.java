package tw.gc.strategy.optimizer.enums;

/**
 * Reason code attached to a failed trial.
 */
public enum FailureReason {
    /** The evaluator threw. */
    EVALUATION_ERROR,
    /** The evaluator did not answer within the per-trial timeout. */
    TIMEOUT,
    /** The evaluator answered with a null record or a non-finite core metric. */
    INVALID_METRICS,
    /** The evaluation succeeded but traded less than the configured minimum. */
    INSUFFICIENT_TRADES
}
