package in.tickforge.service.price;

import in.tickforge.config.EngineConfig;
import in.tickforge.domain.market.Candle;
import in.tickforge.domain.market.CandleInterval;
import in.tickforge.exception.PriceOracleException;
import in.tickforge.infrastructure.common.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Decorator adding bounded retry with backoff and batch sanitizing to a price oracle.
 *
 * Each request gets a fresh {@link RetryPolicy#forCandles} policy built from the current
 * configuration. A batch that fails sanitizing counts as a failed attempt.
 */
public final class RetryingPriceOracle implements PriceOracle {
    private static final Logger log = LoggerFactory.getLogger(RetryingPriceOracle.class);

    private final PriceOracle delegate;
    private final Supplier<EngineConfig> config;
    private final RetryPolicy.Sleeper sleeper;

    public RetryingPriceOracle(PriceOracle delegate, Supplier<EngineConfig> config) {
        this(delegate, config, Thread::sleep);
    }

    public RetryingPriceOracle(PriceOracle delegate, Supplier<EngineConfig> config, RetryPolicy.Sleeper sleeper) {
        this.delegate = delegate;
        this.config = config;
        this.sleeper = sleeper;
    }

    @Override
    public List<Candle> getBars(String symbol, CandleInterval interval, Instant until, int limit) {
        return fetch(symbol, "getBars", () -> delegate.getBars(symbol, interval, until, limit));
    }

    @Override
    public List<Candle> getNextBars(String symbol, CandleInterval interval, Instant since, int limit) {
        return fetch(symbol, "getNextBars", () -> delegate.getNextBars(symbol, interval, since, limit));
    }

    private List<Candle> fetch(String symbol, String operation, RetryPolicy.Call<List<Candle>> call) {
        EngineConfig cfg = config.get();
        RetryPolicy policy = RetryPolicy.forCandles(cfg);
        try {
            return policy.execute(() -> {
                try {
                    List<Candle> candles = call.run();
                    String problem = CandleSanitizer.findProblem(
                        candles, cfg.priceAnomalyThresholdFactor(), cfg.minCandlesForMedian());
                    if (problem != null) {
                        throw new PriceOracleException(symbol, "Rejected candles: " + problem);
                    }
                    return candles;
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    log.warn("[ORACLE] {} {} attempt failed: {}", operation, symbol, e.getMessage());
                    throw e;
                }
            }, sleeper);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PriceOracleException(symbol, operation + " interrupted", e);
        } catch (PriceOracleException e) {
            throw e;
        } catch (Exception e) {
            throw new PriceOracleException(symbol,
                "Failed to " + operation + " after " + policy.getAttemptCount() + " attempts", e);
        }
    }
}
