package in.tickforge.service.price;

import in.tickforge.domain.market.Candle;

import java.util.List;

/**
 * VWAP Calculator - volume-weighted reference price over a trailing window.
 *
 * Calculation Method:
 * - Typical price: TP = (High + Low + Close) / 3
 * - VWAP = Σ(TP × Volume) / Σ(Volume)
 * - Σ(Volume) = 0 ⇒ simple average of closes
 */
public final class VwapCalculator {

    /**
     * @param candles bars in chronological order
     * @return reference price
     * @throws IllegalArgumentException if no bars are given
     */
    public static double calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            throw new IllegalArgumentException("VWAP needs at least one candle");
        }

        double sumPriceVolume = 0.0;
        double sumVolume = 0.0;
        for (Candle candle : candles) {
            sumPriceVolume += candle.typicalPrice() * candle.volume();
            sumVolume += candle.volume();
        }

        if (sumVolume == 0.0) {
            double sumClose = 0.0;
            for (Candle candle : candles) {
                sumClose += candle.close();
            }
            return sumClose / candles.size();
        }

        return sumPriceVolume / sumVolume;
    }

    /**
     * VWAP over the last {@code window} bars ending at {@code endInclusive}.
     * Fewer bars are used when the list starts later than the window.
     */
    public static double trailing(List<Candle> candles, int endInclusive, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("VWAP window must be positive: " + window);
        }
        int from = Math.max(0, endInclusive - window + 1);
        return calculate(candles.subList(from, endInclusive + 1));
    }

    private VwapCalculator() {}
}
