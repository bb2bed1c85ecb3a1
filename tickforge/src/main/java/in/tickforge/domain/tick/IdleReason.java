package in.tickforge.domain.tick;

/**
 * Why an evaluation ended without a position.
 */
public enum IdleReason {
    NO_SIGNAL,          // Generator returned nothing (or failed recoverably)
    THROTTLED,          // Generation interval has not elapsed yet
    STOPPED,            // Instance stopped, nothing left to drain
    REJECTED,           // Proposal failed validation
    ADMISSION_REJECTED  // Admission gate refused the proposal or the activation
}
