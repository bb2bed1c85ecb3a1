package in.tickforge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine configuration validator.
 *
 * Collects every violation instead of stopping at the first one, then refuses the
 * config with a single IllegalStateException listing all of them.
 */
public final class ConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    /**
     * Validate a configuration.
     *
     * @throws IllegalStateException if any option is out of range
     */
    public static void validate(EngineConfig config) {
        List<String> errors = collectErrors(config);
        if (!errors.isEmpty()) {
            StringBuilder message = new StringBuilder("Engine config validation failed:");
            for (int i = 0; i < errors.size(); i++) {
                message.append("\n  ").append(i + 1).append(". ").append(errors.get(i));
            }
            log.warn(message.toString());
            throw new IllegalStateException(message.toString());
        }
        log.debug("Engine config validation passed");
    }

    /**
     * List all violations (empty when the config is valid).
     */
    public static List<String> collectErrors(EngineConfig config) {
        List<String> errors = new ArrayList<>();

        if (!Double.isFinite(config.percentSlippage()) || config.percentSlippage() < 0) {
            errors.add("percentSlippage must be a non-negative number, got " + config.percentSlippage());
        }
        if (!Double.isFinite(config.percentFee()) || config.percentFee() < 0) {
            errors.add("percentFee must be a non-negative number, got " + config.percentFee());
        }

        double requiredTp = config.roundTripCostPercent();
        if (!Double.isFinite(config.minTakeProfitDistancePercent()) || config.minTakeProfitDistancePercent() <= 0) {
            errors.add("minTakeProfitDistancePercent must be a positive number, got "
                + config.minTakeProfitDistancePercent());
        } else if (config.minTakeProfitDistancePercent() < requiredTp) {
            errors.add(String.format(
                "minTakeProfitDistancePercent (%s%%) is too low to cover trading costs: required %.2f%% "
                    + "(slippage %s%% x 2, fee %s%% x 2)",
                config.minTakeProfitDistancePercent(), requiredTp,
                config.percentSlippage(), config.percentFee()));
        }

        if (!Double.isFinite(config.minStopLossDistancePercent()) || config.minStopLossDistancePercent() <= 0) {
            errors.add("minStopLossDistancePercent must be a positive number, got "
                + config.minStopLossDistancePercent());
        }
        if (!Double.isFinite(config.maxStopLossDistancePercent()) || config.maxStopLossDistancePercent() <= 0) {
            errors.add("maxStopLossDistancePercent must be a positive number, got "
                + config.maxStopLossDistancePercent());
        }
        if (Double.isFinite(config.minStopLossDistancePercent())
            && Double.isFinite(config.maxStopLossDistancePercent())
            && config.minStopLossDistancePercent() >= config.maxStopLossDistancePercent()) {
            errors.add("minStopLossDistancePercent (" + config.minStopLossDistancePercent()
                + "%) must be less than maxStopLossDistancePercent (" + config.maxStopLossDistancePercent() + "%)");
        }

        if (config.scheduleAwaitMinutes() <= 0) {
            errors.add("scheduleAwaitMinutes must be a positive integer, got " + config.scheduleAwaitMinutes());
        }
        if (config.maxSignalLifetimeMinutes() <= 0) {
            errors.add("maxSignalLifetimeMinutes must be a positive integer, got " + config.maxSignalLifetimeMinutes());
        }
        if (config.maxSignalGenerationSeconds() <= 0) {
            errors.add("maxSignalGenerationSeconds must be a positive integer, got "
                + config.maxSignalGenerationSeconds());
        }
        if (config.avgPriceCandlesCount() <= 0) {
            errors.add("avgPriceCandlesCount must be a positive integer, got " + config.avgPriceCandlesCount());
        }
        if (config.candleRetryCount() < 0) {
            errors.add("candleRetryCount must be a non-negative integer, got " + config.candleRetryCount());
        }
        if (config.candleRetryDelayMs() < 0) {
            errors.add("candleRetryDelayMs must be a non-negative integer, got " + config.candleRetryDelayMs());
        }
        if (config.priceAnomalyThresholdFactor() <= 0) {
            errors.add("priceAnomalyThresholdFactor must be a positive integer, got "
                + config.priceAnomalyThresholdFactor());
        }
        if (config.minCandlesForMedian() <= 0) {
            errors.add("minCandlesForMedian must be a positive integer, got " + config.minCandlesForMedian());
        }

        return errors;
    }

    private ConfigValidator() {}
}
