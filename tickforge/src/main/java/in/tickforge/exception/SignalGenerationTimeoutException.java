package in.tickforge.exception;

import java.time.Duration;

/**
 * Thrown when the strategy's signal generator does not answer within the configured bound.
 * A stalled generator is never retried.
 */
public class SignalGenerationTimeoutException extends FatalEngineException {

    private final Duration timeout;

    public SignalGenerationTimeoutException(String scope, Duration timeout) {
        super(scope, "Signal generation exceeded " + timeout.toSeconds() + "s");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
