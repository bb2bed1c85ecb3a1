package in.tickforge.exception;

/**
 * Fault that halts processing for the affected key and must reach the operator.
 */
public class FatalEngineException extends EngineException {

    public FatalEngineException(String scope, String message) {
        super(scope, message);
    }

    public FatalEngineException(String scope, String message, Throwable cause) {
        super(scope, message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
