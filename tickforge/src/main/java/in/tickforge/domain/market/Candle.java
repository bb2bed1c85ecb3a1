package in.tickforge.domain.market;

import java.time.Instant;

/**
 * OHLCV bar.
 *
 * {@code timestamp} is the bar's open time; the bar is complete at {@link #closeTime()}.
 */
public record Candle(
    Instant timestamp,
    CandleInterval interval,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    /**
     * Instant at which the bar is complete and may be used for evaluation.
     */
    public Instant closeTime() {
        return timestamp.plus(interval.toDuration());
    }

    /**
     * Typical price (high + low + close) / 3, used for VWAP.
     */
    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }

    /**
     * One-minute candle from raw values.
     */
    public static Candle of(Instant ts, double o, double h, double l, double c, double v) {
        return new Candle(ts, CandleInterval.MINUTE_1, o, h, l, c, v);
    }

    /**
     * Flat one-minute candle (open = high = low = close).
     */
    public static Candle flat(Instant ts, double price, double v) {
        return of(ts, price, price, price, price, v);
    }
}
