package tw.gc.strategy.optimizer.exceptions;

/**
 * Root of the optimizer's unchecked failures that invalidate a whole operation.
 */
public class OptimizerException extends RuntimeException {

    public OptimizerException(String message) {
        super(message);
    }

    public OptimizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
