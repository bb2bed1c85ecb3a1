package in.tickforge.domain.tick;

import in.tickforge.domain.signal.SignalKey;

import java.time.Instant;

/**
 * No position and nothing created.
 */
public record IdleResult(SignalKey key, Instant when, IdleReason reason) implements TickResult {

    @Override
    public TickAction action() {
        return TickAction.IDLE;
    }
}
