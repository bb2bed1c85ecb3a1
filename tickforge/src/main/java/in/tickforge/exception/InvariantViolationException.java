package in.tickforge.exception;

/**
 * Thrown when data that already passed validation breaks a signal invariant.
 */
public class InvariantViolationException extends FatalEngineException {

    public InvariantViolationException(String scope, String message) {
        super(scope, message);
    }
}
