package tw.gc.strategy.optimizer.exceptions;

/**
 * Raised for malformed parameter declarations, always before any trial runs.
 */
public class InvalidSpaceException extends IllegalArgumentException {

    public InvalidSpaceException(String message) {
        super(message);
    }
}
