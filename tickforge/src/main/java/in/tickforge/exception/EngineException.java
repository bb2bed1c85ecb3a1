package in.tickforge.exception;

/**
 * Base class for faults raised by the signal engine.
 *
 * Trade rejections are not faults and never use this hierarchy.
 */
public abstract class EngineException extends RuntimeException {

    private final String scope;

    protected EngineException(String scope, String message) {
        super(format(scope, message));
        this.scope = scope;
    }

    protected EngineException(String scope, String message, Throwable cause) {
        super(format(scope, message), cause);
        this.scope = scope;
    }

    /**
     * Fatal faults stop processing for the affected key.
     */
    public abstract boolean isFatal();

    /**
     * Key or component the fault belongs to (may be null).
     */
    public String getScope() {
        return scope;
    }

    private static String format(String scope, String message) {
        return scope != null ? String.format("[%s] %s", scope, message) : message;
    }
}
