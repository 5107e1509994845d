package tw.gc.strategy.optimizer.exceptions;

/**
 * Thrown by a backtest evaluator that cannot produce metrics for a trial.
 * Never escapes a run: the trial adapter records it as a failed outcome.
 */
public class EvaluationException extends Exception {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
