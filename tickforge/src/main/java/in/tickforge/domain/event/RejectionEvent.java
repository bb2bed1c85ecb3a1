package in.tickforge.domain.event;

import in.tickforge.domain.signal.SignalKey;
import in.tickforge.domain.signal.SignalProposal;

import java.time.Instant;

/**
 * Proposal or activation refused by validation or admission.
 *
 * @param code validation error code name, or {@code ADMISSION} for gate refusals
 */
public record RejectionEvent(
    SignalKey key,
    Instant when,
    SignalProposal proposal,
    String code,
    String message,
    boolean backtest
) {
    public static final String ADMISSION = "ADMISSION";
}
