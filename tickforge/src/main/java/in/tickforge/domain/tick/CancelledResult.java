package in.tickforge.domain.tick;

import in.tickforge.domain.signal.CancelReason;
import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalKey;

import java.time.Instant;

/**
 * Scheduled order discarded before activation.
 *
 * @param currentPrice reference price at cancellation, NaN for user cancellations
 */
public record CancelledResult(
    SignalKey key,
    Instant when,
    Signal signal,
    double currentPrice,
    CancelReason reason
) implements TickResult {

    @Override
    public TickAction action() {
        return TickAction.CANCELLED;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }
}
