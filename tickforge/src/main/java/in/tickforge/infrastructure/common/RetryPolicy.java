package in.tickforge.infrastructure.common;

import in.tickforge.config.EngineConfig;

import java.time.Duration;
import java.time.Instant;

/**
 * Bounded retry with exponential backoff.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Maximum attempt limit (first call included)
 * - Maximum backoff duration (cap)
 * - Exhausted state after max failures
 * - Reset after success
 *
 * Usage:
 * <pre>
 * List&lt;Candle&gt; bars = RetryPolicy.forCandles(config)
 *     .execute(() -&gt; exchange.fetch(symbol, since, limit), Thread::sleep);
 * </pre>
 *
 * One instance tracks one operation; it is not meant to be shared between unrelated calls.
 */
public class RetryPolicy {

    /**
     * Operation that may fail and be retried.
     */
    @FunctionalInterface
    public interface Call<T> {
        T run() throws Exception;
    }

    /**
     * Pause between attempts (replaced by a no-op in tests).
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;
    private boolean exhausted = false;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * Run {@code call} until it succeeds or the attempts are used up.
     *
     * @return the call's result
     * @throws Exception the last failure once attempts are exhausted
     */
    public <T> T execute(Call<T> call, Sleeper sleeper) throws Exception {
        while (true) {
            try {
                T result = call.run();
                recordSuccess();
                return result;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                long delay = getNextDelay().toMillis();
                recordFailure();
                if (!shouldRetry()) {
                    throw e;
                }
                sleeper.sleep(delay);
            }
        }
    }

    /**
     * Check if another attempt should be made.
     */
    public synchronized boolean shouldRetry() {
        if (exhausted) {
            return false;
        }
        return attemptCount < maxAttempts;
    }

    /**
     * Delay before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt: bumps the count and grows the delay.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();

        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));

        if (attemptCount >= maxAttempts) {
            exhausted = true;
        }
    }

    /**
     * Record a success: resets counters.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
        exhausted = false;
    }

    public synchronized boolean isExhausted() {
        return exhausted;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Policy for price oracle requests: one call plus {@code candleRetryCount} retries.
     */
    public static RetryPolicy forCandles(EngineConfig config) {
        return builder()
            .initialDelay(Duration.ofMillis(config.candleRetryDelayMs()))
            .maxDelay(Duration.ofMillis(Math.max(config.candleRetryDelayMs() * 8, 1)))
            .multiplier(2.0)
            .maxAttempts(config.candleRetryCount() + 1)
            .build();
    }

    /**
     * Policy for removing corrupt persisted records: five attempts, one second apart.
     */
    public static RetryPolicy forRecordRemoval() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(1))
            .multiplier(1.0)
            .maxAttempts(5)
            .build();
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("Initial delay must not be negative");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("Max delay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay must not exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
