package in.tickforge.domain.tick;

import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalKey;

import java.time.Instant;

/**
 * Scheduled order created, still waiting for its entry price, or restored on startup.
 */
public record ScheduledResult(
    SignalKey key,
    Instant when,
    Signal signal,
    double currentPrice,
    boolean restored
) implements TickResult {

    @Override
    public TickAction action() {
        return TickAction.SCHEDULED;
    }
}
