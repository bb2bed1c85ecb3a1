package in.tickforge.service.price;

import in.tickforge.domain.market.Candle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Candle Sanitizer - rejects bar sets an exchange should never have returned.
 *
 * A batch is refused as a whole when any bar has a non-finite value, a non-positive price,
 * a negative volume, or a price below {@code reference / anomalyFactor}. The reference is the
 * median of all OHLC prices when the batch has at least {@code minCandlesForMedian} bars,
 * otherwise their mean.
 */
public final class CandleSanitizer {

    /**
     * @return null when the batch is clean, otherwise a description of the first problem
     */
    public static String findProblem(List<Candle> candles, double anomalyFactor, int minCandlesForMedian) {
        if (candles == null || candles.isEmpty()) {
            return null;
        }

        List<Double> prices = new ArrayList<>(candles.size() * 4);
        for (Candle c : candles) {
            double[] values = {c.open(), c.high(), c.low(), c.close(), c.volume()};
            for (double v : values) {
                if (!Double.isFinite(v)) {
                    return "non-finite value in candle at " + c.timestamp();
                }
            }
            if (c.open() <= 0 || c.high() <= 0 || c.low() <= 0 || c.close() <= 0) {
                return "non-positive price in candle at " + c.timestamp();
            }
            if (c.volume() < 0) {
                return "negative volume in candle at " + c.timestamp();
            }
            prices.add(c.open());
            prices.add(c.high());
            prices.add(c.low());
            prices.add(c.close());
        }

        double reference = candles.size() >= minCandlesForMedian ? median(prices) : mean(prices);
        double threshold = reference / anomalyFactor;
        for (Candle c : candles) {
            if (c.open() < threshold || c.high() < threshold || c.low() < threshold || c.close() < threshold) {
                return String.format("anomalous price in candle at %s (reference %.8f, threshold %.8f)",
                    c.timestamp(), reference, threshold);
            }
        }
        return null;
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 0) {
            return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
        }
        return sorted.get(mid);
    }

    static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private CandleSanitizer() {}
}
