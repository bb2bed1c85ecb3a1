package in.tickforge.domain.event;

import in.tickforge.domain.tick.TickResult;

import java.time.Instant;

/**
 * Committed state transition, as delivered to subscribers.
 *
 * @param seq monotonically increasing per bus, assigned at publish time
 */
public record SignalEvent(
    long seq,
    boolean backtest,
    Instant emittedAt,
    TickResult result
) {
}
