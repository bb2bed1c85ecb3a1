package in.tickforge.service.strategy;

import in.tickforge.domain.signal.SignalProposal;

import java.time.Instant;
import java.util.Optional;

/**
 * User strategy logic: proposes a trade for a symbol at an instant, or nothing.
 *
 * Called on a separate thread under the configured generation timeout.
 */
@FunctionalInterface
public interface SignalGenerator {

    Optional<SignalProposal> generate(String symbol, Instant when) throws Exception;
}
