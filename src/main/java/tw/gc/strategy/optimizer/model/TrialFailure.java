package tw.gc.strategy.optimizer.model;

import tw.gc.strategy.optimizer.enums.FailureReason;

/**
 * Typed failure of a single trial.
 *
 * @param reason Reason code
 * @param message Human-readable detail, usually the evaluator's exception message
 */
public record TrialFailure(FailureReason reason, String message) {

    public static TrialFailure of(FailureReason reason, String message) {
        return new TrialFailure(reason, message);
    }

    public static TrialFailure timeout(long timeoutMs) {
        return new TrialFailure(FailureReason.TIMEOUT, "Evaluation exceeded %d ms".formatted(timeoutMs));
    }
}
