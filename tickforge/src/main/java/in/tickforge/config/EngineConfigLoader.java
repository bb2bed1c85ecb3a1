package in.tickforge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tickforge.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds an {@link EngineConfig} from defaults, an optional JSON file and
 * environment overrides (in that order of precedence, last wins).
 *
 * Environment keys: TF_PERCENT_FEE, TF_PERCENT_SLIPPAGE, TF_MIN_TAKEPROFIT_DISTANCE_PERCENT,
 * TF_MIN_STOPLOSS_DISTANCE_PERCENT, TF_MAX_STOPLOSS_DISTANCE_PERCENT, TF_MAX_SIGNAL_LIFETIME_MINUTES,
 * TF_SCHEDULE_AWAIT_MINUTES, TF_AVG_PRICE_CANDLES_COUNT, TF_MAX_SIGNAL_GENERATION_SECONDS,
 * TF_CANDLE_RETRY_COUNT, TF_CANDLE_RETRY_DELAY_MS, TF_PRICE_ANOMALY_THRESHOLD_FACTOR,
 * TF_MIN_CANDLES_FOR_MEDIAN.
 */
public final class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Load config: defaults, then file (if present), then environment.
     *
     * @param configFile JSON file with any subset of the config fields, or null
     */
    public static EngineConfig load(Path configFile) {
        EngineConfig fromFile = configFile != null ? readFile(configFile) : EngineConfig.defaults();
        EngineConfig merged = applyEnv(fromFile);
        ConfigValidator.validate(merged);
        log.info("Effective engine config: {}", merged);
        return merged;
    }

    /**
     * Read a (partial) JSON config on top of the defaults.
     */
    public static EngineConfig readFile(Path configFile) {
        if (!Files.exists(configFile)) {
            log.info("Config file {} not found, using defaults", configFile);
            return EngineConfig.defaults();
        }
        try {
            JsonNode overrides = MAPPER.readTree(configFile.toFile());
            return merge(EngineConfig.defaults(), overrides);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read engine config " + configFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Overlay the fields present in {@code overrides} onto {@code base}.
     */
    public static EngineConfig merge(EngineConfig base, JsonNode overrides) {
        if (overrides == null || !overrides.isObject()) {
            return base;
        }
        ObjectNode tree = MAPPER.valueToTree(base);
        tree.setAll((ObjectNode) overrides);
        try {
            return MAPPER.treeToValue(tree, EngineConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Invalid engine config: " + e.getMessage(), e);
        }
    }

    static EngineConfig applyEnv(EngineConfig base) {
        return base.toBuilder()
            .percentFee(Env.getDouble("TF_PERCENT_FEE", base.percentFee()))
            .percentSlippage(Env.getDouble("TF_PERCENT_SLIPPAGE", base.percentSlippage()))
            .minTakeProfitDistancePercent(
                Env.getDouble("TF_MIN_TAKEPROFIT_DISTANCE_PERCENT", base.minTakeProfitDistancePercent()))
            .minStopLossDistancePercent(
                Env.getDouble("TF_MIN_STOPLOSS_DISTANCE_PERCENT", base.minStopLossDistancePercent()))
            .maxStopLossDistancePercent(
                Env.getDouble("TF_MAX_STOPLOSS_DISTANCE_PERCENT", base.maxStopLossDistancePercent()))
            .maxSignalLifetimeMinutes(Env.getInt("TF_MAX_SIGNAL_LIFETIME_MINUTES", base.maxSignalLifetimeMinutes()))
            .scheduleAwaitMinutes(Env.getInt("TF_SCHEDULE_AWAIT_MINUTES", base.scheduleAwaitMinutes()))
            .avgPriceCandlesCount(Env.getInt("TF_AVG_PRICE_CANDLES_COUNT", base.avgPriceCandlesCount()))
            .maxSignalGenerationSeconds(
                Env.getInt("TF_MAX_SIGNAL_GENERATION_SECONDS", base.maxSignalGenerationSeconds()))
            .candleRetryCount(Env.getInt("TF_CANDLE_RETRY_COUNT", base.candleRetryCount()))
            .candleRetryDelayMs(Env.getLong("TF_CANDLE_RETRY_DELAY_MS", base.candleRetryDelayMs()))
            .priceAnomalyThresholdFactor(
                Env.getInt("TF_PRICE_ANOMALY_THRESHOLD_FACTOR", base.priceAnomalyThresholdFactor()))
            .minCandlesForMedian(Env.getInt("TF_MIN_CANDLES_FOR_MEDIAN", base.minCandlesForMedian()))
            .build();
    }

    private EngineConfigLoader() {}
}
