package in.tickforge.service.price;

import in.tickforge.domain.market.Candle;
import in.tickforge.domain.market.CandleInterval;
import in.tickforge.exception.MissingPriceDataException;

import java.time.Instant;
import java.util.List;

/**
 * Source of OHLCV bars for a trading pair.
 *
 * Implementations may block on network or disk I/O. Failures surface as
 * {@link in.tickforge.exception.PriceOracleException}.
 */
public interface PriceOracle {

    /**
     * Bars whose close time is at or before {@code until}, oldest first, at most {@code limit}.
     */
    List<Candle> getBars(String symbol, CandleInterval interval, Instant until, int limit);

    /**
     * Bars opening at or after {@code since}, oldest first, at most {@code limit}.
     * Never returns bars that close after the present.
     */
    List<Candle> getNextBars(String symbol, CandleInterval interval, Instant since, int limit);

    /**
     * VWAP of the trailing {@code window} one-minute bars ending at {@code when}.
     *
     * @throws MissingPriceDataException if there are no bars up to {@code when}
     */
    default double getReferencePrice(String symbol, Instant when, int window) {
        List<Candle> bars = getBars(symbol, CandleInterval.MINUTE_1, when, window);
        if (bars == null || bars.isEmpty()) {
            throw new MissingPriceDataException(symbol, "No bars for reference price at " + when);
        }
        return VwapCalculator.calculate(bars);
    }
}
