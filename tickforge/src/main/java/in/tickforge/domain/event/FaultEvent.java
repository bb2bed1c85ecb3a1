package in.tickforge.domain.event;

import in.tickforge.domain.signal.SignalKey;

import java.time.Instant;

/**
 * Error reported on the fault channel instead of crashing a background worker.
 *
 * @param key affected key, null when not tied to one
 */
public record FaultEvent(
    SignalKey key,
    Instant at,
    Throwable error,
    boolean fatal
) {
}
