package tw.gc.strategy.optimizer.exceptions;

/**
 * I/O failure inside the results store.
 */
public class ResultsStoreException extends OptimizerException {

    public ResultsStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public ResultsStoreException(String message) {
        super(message);
    }
}
