package in.tickforge.domain.risk;

import in.tickforge.domain.signal.SignalKey;

import java.time.Instant;

/**
 * What the admission gate knows about the requesting instance.
 */
public record AdmissionContext(
    SignalKey key,
    double currentPrice,
    Instant when,
    boolean backtest
) {
}
