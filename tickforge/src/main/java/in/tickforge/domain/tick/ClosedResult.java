package in.tickforge.domain.tick;

import in.tickforge.domain.signal.CloseReason;
import in.tickforge.domain.signal.ProfitLoss;
import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalKey;

import java.time.Duration;
import java.time.Instant;

/**
 * Position exited.
 *
 * @param closePrice exact TP/SL level for TP/SL exits, reference price for time expiry
 */
public record ClosedResult(
    SignalKey key,
    Instant when,
    Signal signal,
    double closePrice,
    CloseReason reason,
    ProfitLoss pnl
) implements TickResult {

    @Override
    public TickAction action() {
        return TickAction.CLOSED;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    /**
     * Time between activation and exit.
     */
    public Duration elapsed() {
        return Duration.between(signal.pendingAt(), when);
    }
}
