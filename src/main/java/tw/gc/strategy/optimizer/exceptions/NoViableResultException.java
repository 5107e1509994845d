package tw.gc.strategy.optimizer.exceptions;

/**
 * A search finished without a single successful trial. Nothing is persisted.
 */
public class NoViableResultException extends OptimizerException {

    private final int attemptedTrials;

    public NoViableResultException(String message, int attemptedTrials) {
        super(message);
        this.attemptedTrials = attemptedTrials;
    }

    public int getAttemptedTrials() {
        return attemptedTrials;
    }
}
