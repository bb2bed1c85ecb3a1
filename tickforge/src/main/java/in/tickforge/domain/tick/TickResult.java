package in.tickforge.domain.tick;

import in.tickforge.domain.signal.SignalKey;

import java.time.Instant;

/**
 * Outcome of one evaluation of a state machine.
 *
 * Closed set of variants; each carries only the data that belongs to it, e.g. a
 * {@link ClosedResult} always has an exit reason and a realized P&L.
 */
public sealed interface TickResult
    permits IdleResult, ScheduledResult, OpenedResult, ActiveResult, ClosedResult, CancelledResult {

    SignalKey key();

    /**
     * Evaluation instant the result belongs to.
     */
    Instant when();

    TickAction action();

    /**
     * Closed and cancelled results end a signal's life.
     */
    default boolean isTerminal() {
        return false;
    }
}
