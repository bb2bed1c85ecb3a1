package in.tickforge.service.price;

import in.tickforge.domain.market.Candle;
import in.tickforge.domain.market.CandleInterval;
import in.tickforge.exception.PriceOracleException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory candle history, keyed by symbol and interval.
 *
 * Used by backtests and tests. {@link #getNextBars} never hands out a bar that closes after
 * the clock's present, so a backtest cannot peek into the real future.
 */
public final class HistoricalPriceOracle implements PriceOracle {

    private final Map<String, List<Candle>> history = new ConcurrentHashMap<>();
    private final Clock clock;

    public HistoricalPriceOracle() {
        this(Clock.systemUTC());
    }

    public HistoricalPriceOracle(Clock clock) {
        this.clock = clock;
    }

    /**
     * Add bars for a symbol. Bars are kept sorted by open time; duplicates replace older entries.
     */
    public HistoricalPriceOracle load(String symbol, List<Candle> candles) {
        for (Candle candle : candles) {
            List<Candle> series = history.computeIfAbsent(key(symbol, candle.interval()), k -> new ArrayList<>());
            synchronized (series) {
                series.removeIf(c -> c.timestamp().equals(candle.timestamp()));
                series.add(candle);
                series.sort(Comparator.comparing(Candle::timestamp));
            }
        }
        return this;
    }

    @Override
    public List<Candle> getBars(String symbol, CandleInterval interval, Instant until, int limit) {
        List<Candle> series = series(symbol, interval);
        List<Candle> result = new ArrayList<>();
        synchronized (series) {
            for (Candle c : series) {
                if (!c.closeTime().isAfter(until)) {
                    result.add(c);
                }
            }
        }
        int from = Math.max(0, result.size() - limit);
        return new ArrayList<>(result.subList(from, result.size()));
    }

    @Override
    public List<Candle> getNextBars(String symbol, CandleInterval interval, Instant since, int limit) {
        Instant now = clock.instant();
        List<Candle> series = series(symbol, interval);
        List<Candle> result = new ArrayList<>();
        synchronized (series) {
            for (Candle c : series) {
                if (result.size() >= limit) {
                    break;
                }
                if (c.timestamp().isBefore(since)) {
                    continue;
                }
                if (c.closeTime().isAfter(now)) {
                    break;
                }
                result.add(c);
            }
        }
        return result;
    }

    private List<Candle> series(String symbol, CandleInterval interval) {
        List<Candle> series = history.get(key(symbol, interval));
        if (series == null) {
            throw new PriceOracleException(symbol, "No " + interval.getCode() + " history loaded");
        }
        return series;
    }

    private static String key(String symbol, CandleInterval interval) {
        return symbol + "|" + interval.getCode();
    }
}
