package in.tickforge.domain.tick;

import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalKey;

import java.time.Instant;

/**
 * Position entered (immediately or by scheduled-order activation), or restored on startup.
 */
public record OpenedResult(
    SignalKey key,
    Instant when,
    Signal signal,
    double currentPrice,
    boolean restored
) implements TickResult {

    @Override
    public TickAction action() {
        return TickAction.OPENED;
    }
}
