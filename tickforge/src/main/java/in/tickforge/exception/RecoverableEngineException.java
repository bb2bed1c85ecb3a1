package in.tickforge.exception;

/**
 * Fault after which processing continues: the affected key skips the cycle or the
 * affected record is discarded.
 */
public class RecoverableEngineException extends EngineException {

    public RecoverableEngineException(String scope, String message) {
        super(scope, message);
    }

    public RecoverableEngineException(String scope, String message, Throwable cause) {
        super(scope, message, cause);
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
