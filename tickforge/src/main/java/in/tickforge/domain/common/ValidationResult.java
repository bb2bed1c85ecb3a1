package in.tickforge.domain.common;

/**
 * Result of signal validation: passed, or the first failed check.
 */
public record ValidationResult(
    boolean passed,
    ValidationErrorCode code,
    String message
) {
    private static final ValidationResult PASSED = new ValidationResult(true, null, null);

    public static ValidationResult pass() {
        return PASSED;
    }

    public static ValidationResult fail(ValidationErrorCode code, String message) {
        return new ValidationResult(false, code, message);
    }
}
