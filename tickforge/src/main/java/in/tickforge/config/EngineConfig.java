package in.tickforge.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run-time configuration of the signal engine.
 *
 * Percent values are plain percentages (0.1 = 0.1%). Every state machine reads its
 * configuration through a supplier, so a replaced instance takes effect on the next
 * evaluation.
 */
public record EngineConfig(
    @JsonProperty("percentFee")
    double percentFee,                      // Exchange fee per transaction, charged on entry and on exit

    @JsonProperty("percentSlippage")
    double percentSlippage,                 // Slippage per transaction, applied against the trader

    @JsonProperty("minTakeProfitDistancePercent")
    double minTakeProfitDistancePercent,    // Entry → TP distance must be at least this

    @JsonProperty("minStopLossDistancePercent")
    double minStopLossDistancePercent,      // Entry → SL distance must be at least this

    @JsonProperty("maxStopLossDistancePercent")
    double maxStopLossDistancePercent,      // Entry → SL distance must not exceed this

    @JsonProperty("maxSignalLifetimeMinutes")
    int maxSignalLifetimeMinutes,           // Upper bound on a proposal's estimated lifetime

    @JsonProperty("scheduleAwaitMinutes")
    int scheduleAwaitMinutes,               // Scheduled order is cancelled after waiting this long

    @JsonProperty("avgPriceCandlesCount")
    int avgPriceCandlesCount,               // VWAP window (one-minute bars)

    @JsonProperty("maxSignalGenerationSeconds")
    int maxSignalGenerationSeconds,         // Generator call exceeding this is fatal

    @JsonProperty("candleRetryCount")
    int candleRetryCount,                   // Oracle retries after the first failed attempt

    @JsonProperty("candleRetryDelayMs")
    long candleRetryDelayMs,                // Initial oracle retry delay (doubles per attempt)

    @JsonProperty("priceAnomalyThresholdFactor")
    int priceAnomalyThresholdFactor,        // Price below reference / factor marks an incomplete bar

    @JsonProperty("minCandlesForMedian")
    int minCandlesForMedian                 // Median reference needs at least this many bars, mean otherwise
) {
    /**
     * Default configuration.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(
            0.1,    // 0.1% fee
            0.1,    // 0.1% slippage
            0.5,    // TP at least 0.5% away (covers 0.4% round-trip cost)
            0.5,    // SL at least 0.5% away
            20.0,   // SL at most 20% away
            1_440,  // One day max lifetime
            120,    // Two hours for a scheduled order
            5,      // 5 x 1m VWAP window
            180,    // Three minutes for the generator
            3,
            5_000,
            1_000,
            5
        );
    }

    /**
     * Round-trip trading cost in percent: fee and slippage, each paid on entry and exit.
     */
    public double roundTripCostPercent() {
        return percentFee * 2 + percentSlippage * 2;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    /**
     * Builder for per-instance or per-test overrides on top of an existing config.
     */
    public static final class Builder {
        private double percentFee;
        private double percentSlippage;
        private double minTakeProfitDistancePercent;
        private double minStopLossDistancePercent;
        private double maxStopLossDistancePercent;
        private int maxSignalLifetimeMinutes;
        private int scheduleAwaitMinutes;
        private int avgPriceCandlesCount;
        private int maxSignalGenerationSeconds;
        private int candleRetryCount;
        private long candleRetryDelayMs;
        private int priceAnomalyThresholdFactor;
        private int minCandlesForMedian;

        private Builder(EngineConfig base) {
            this.percentFee = base.percentFee;
            this.percentSlippage = base.percentSlippage;
            this.minTakeProfitDistancePercent = base.minTakeProfitDistancePercent;
            this.minStopLossDistancePercent = base.minStopLossDistancePercent;
            this.maxStopLossDistancePercent = base.maxStopLossDistancePercent;
            this.maxSignalLifetimeMinutes = base.maxSignalLifetimeMinutes;
            this.scheduleAwaitMinutes = base.scheduleAwaitMinutes;
            this.avgPriceCandlesCount = base.avgPriceCandlesCount;
            this.maxSignalGenerationSeconds = base.maxSignalGenerationSeconds;
            this.candleRetryCount = base.candleRetryCount;
            this.candleRetryDelayMs = base.candleRetryDelayMs;
            this.priceAnomalyThresholdFactor = base.priceAnomalyThresholdFactor;
            this.minCandlesForMedian = base.minCandlesForMedian;
        }

        public Builder percentFee(double v) { this.percentFee = v; return this; }
        public Builder percentSlippage(double v) { this.percentSlippage = v; return this; }
        public Builder minTakeProfitDistancePercent(double v) { this.minTakeProfitDistancePercent = v; return this; }
        public Builder minStopLossDistancePercent(double v) { this.minStopLossDistancePercent = v; return this; }
        public Builder maxStopLossDistancePercent(double v) { this.maxStopLossDistancePercent = v; return this; }
        public Builder maxSignalLifetimeMinutes(int v) { this.maxSignalLifetimeMinutes = v; return this; }
        public Builder scheduleAwaitMinutes(int v) { this.scheduleAwaitMinutes = v; return this; }
        public Builder avgPriceCandlesCount(int v) { this.avgPriceCandlesCount = v; return this; }
        public Builder maxSignalGenerationSeconds(int v) { this.maxSignalGenerationSeconds = v; return this; }
        public Builder candleRetryCount(int v) { this.candleRetryCount = v; return this; }
        public Builder candleRetryDelayMs(long v) { this.candleRetryDelayMs = v; return this; }
        public Builder priceAnomalyThresholdFactor(int v) { this.priceAnomalyThresholdFactor = v; return this; }
        public Builder minCandlesForMedian(int v) { this.minCandlesForMedian = v; return this; }

        public EngineConfig build() {
            return new EngineConfig(
                percentFee, percentSlippage,
                minTakeProfitDistancePercent, minStopLossDistancePercent, maxStopLossDistancePercent,
                maxSignalLifetimeMinutes, scheduleAwaitMinutes, avgPriceCandlesCount,
                maxSignalGenerationSeconds, candleRetryCount, candleRetryDelayMs,
                priceAnomalyThresholdFactor, minCandlesForMedian
            );
        }
    }
}
