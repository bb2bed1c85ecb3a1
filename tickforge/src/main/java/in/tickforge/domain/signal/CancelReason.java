package in.tickforge.domain.signal;

/**
 * Why a scheduled order was discarded before activation.
 */
public enum CancelReason {
    TIMEOUT,            // Entry price not reached within the schedule wait
    STOP_LOSS_BREACHED, // Price crossed the stop before reaching the entry
    USER                // Cancelled on request
}
