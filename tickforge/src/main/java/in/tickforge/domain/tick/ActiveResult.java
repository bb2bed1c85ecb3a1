package in.tickforge.domain.tick;

import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalKey;

import java.time.Instant;

/**
 * Position open and still monitored.
 *
 * @param percentTp progress from entry towards TP, 0..100 (0 while price is on the loss side)
 * @param percentSl progress from entry towards SL, 0..100 (0 while price is on the profit side)
 */
public record ActiveResult(
    SignalKey key,
    Instant when,
    Signal signal,
    double currentPrice,
    double percentTp,
    double percentSl
) implements TickResult {

    @Override
    public TickAction action() {
        return TickAction.ACTIVE;
    }
}
