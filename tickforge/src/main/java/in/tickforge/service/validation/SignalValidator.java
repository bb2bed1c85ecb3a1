package in.tickforge.service.validation;

import in.tickforge.config.EngineConfig;
import in.tickforge.domain.common.ValidationErrorCode;
import in.tickforge.domain.common.ValidationResult;
import in.tickforge.domain.signal.Direction;
import in.tickforge.domain.signal.SignalProposal;

/**
 * Signal Validator.
 * Refuses trade proposals whose prices are invalid or economically unviable.
 *
 * Pure function of its arguments: no I/O, no state. Checks run in a fixed order and
 * the first failure is returned. A failure is a normal result, never an exception.
 */
public final class SignalValidator {

    /**
     * Validate a proposal against the current reference price.
     *
     * @param proposal     proposal from strategy logic
     * @param currentPrice reference price at evaluation time
     * @param isScheduled  true when the proposal will wait for its entry price
     * @param config       thresholds
     */
    public static ValidationResult validate(SignalProposal proposal, double currentPrice,
                                            boolean isScheduled, EngineConfig config) {
        // ═══════════════════════════════════════════════════════════════
        // 1. Required fields
        // ═══════════════════════════════════════════════════════════════

        if (proposal == null) {
            return ValidationResult.fail(ValidationErrorCode.MISSING_FIELD, "proposal is missing");
        }
        if (proposal.direction() == null) {
            return ValidationResult.fail(ValidationErrorCode.MISSING_FIELD, "direction is missing");
        }
        if (proposal.priceTakeProfit() == null) {
            return ValidationResult.fail(ValidationErrorCode.MISSING_FIELD, "priceTakeProfit is missing");
        }
        if (proposal.priceStopLoss() == null) {
            return ValidationResult.fail(ValidationErrorCode.MISSING_FIELD, "priceStopLoss is missing");
        }
        if (proposal.minuteEstimatedTime() == null) {
            return ValidationResult.fail(ValidationErrorCode.MISSING_FIELD, "minuteEstimatedTime is missing");
        }
        if (isScheduled && proposal.priceOpen() == null) {
            return ValidationResult.fail(ValidationErrorCode.MISSING_FIELD, "scheduled proposal needs priceOpen");
        }

        double entry = proposal.priceOpen() != null ? proposal.priceOpen() : currentPrice;
        double tp = proposal.priceTakeProfit();
        double sl = proposal.priceStopLoss();

        // ═══════════════════════════════════════════════════════════════
        // 2. Finite, strictly positive prices
        // ═══════════════════════════════════════════════════════════════

        ValidationResult numeric = checkPrice("currentPrice", currentPrice);
        if (numeric == null) numeric = checkPrice("priceOpen", entry);
        if (numeric == null) numeric = checkPrice("priceTakeProfit", tp);
        if (numeric == null) numeric = checkPrice("priceStopLoss", sl);
        if (numeric != null) {
            return numeric;
        }

        // ═══════════════════════════════════════════════════════════════
        // 3. Directional ordering
        // ═══════════════════════════════════════════════════════════════

        // Entry joins the ordering only when the proposal names it; the current price
        // of a market entry is checked against the levels in step 4.
        boolean isLong = proposal.direction() == Direction.LONG;
        boolean ordered = proposal.hasEntryPrice() && !isScheduled
            ? (isLong ? sl < entry && entry < tp : tp < entry && entry < sl)
            : (isLong ? sl < tp : tp < sl);
        if (!ordered) {
            return ValidationResult.fail(ValidationErrorCode.INVALID_PRICE_ORDER, isLong
                ? String.format("long requires stopLoss < entry < takeProfit, got sl=%s entry=%s tp=%s", sl, entry, tp)
                : String.format("short requires takeProfit < entry < stopLoss, got tp=%s entry=%s sl=%s", tp, entry, sl));
        }

        // ═══════════════════════════════════════════════════════════════
        // 4. Position would not close on the evaluation it opens
        // ═══════════════════════════════════════════════════════════════

        if (!isScheduled) {
            boolean pastStop = isLong ? currentPrice <= sl : currentPrice >= sl;
            if (pastStop) {
                return ValidationResult.fail(ValidationErrorCode.PRICE_PAST_STOP_LOSS,
                    String.format("current price %s already past stop-loss %s", currentPrice, sl));
            }
            boolean pastTarget = isLong ? currentPrice >= tp : currentPrice <= tp;
            if (pastTarget) {
                return ValidationResult.fail(ValidationErrorCode.PRICE_PAST_TAKE_PROFIT,
                    String.format("current price %s already past take-profit %s", currentPrice, tp));
            }
        } else {
            boolean inside = isLong ? (sl < entry && entry < tp) : (tp < entry && entry < sl);
            if (!inside) {
                return ValidationResult.fail(ValidationErrorCode.ENTRY_OUTSIDE_RANGE,
                    String.format("entry %s must lie strictly between stop-loss %s and take-profit %s", entry, sl, tp));
            }
        }

        // ═══════════════════════════════════════════════════════════════
        // 5. Distances
        // ═══════════════════════════════════════════════════════════════

        double tpDistance = Math.abs(tp - entry) / entry * 100.0;
        double requiredTp = Math.max(config.minTakeProfitDistancePercent(), config.roundTripCostPercent());
        if (tpDistance < requiredTp) {
            return ValidationResult.fail(ValidationErrorCode.TAKE_PROFIT_TOO_CLOSE,
                String.format("take-profit distance %.4f%% below minimum %.4f%% (round-trip cost %.4f%%)",
                    tpDistance, requiredTp, config.roundTripCostPercent()));
        }

        double slDistance = Math.abs(entry - sl) / entry * 100.0;
        if (slDistance < config.minStopLossDistancePercent()) {
            return ValidationResult.fail(ValidationErrorCode.STOP_LOSS_TOO_CLOSE,
                String.format("stop-loss distance %.4f%% below minimum %.4f%%",
                    slDistance, config.minStopLossDistancePercent()));
        }
        if (slDistance > config.maxStopLossDistancePercent()) {
            return ValidationResult.fail(ValidationErrorCode.STOP_LOSS_TOO_FAR,
                String.format("stop-loss distance %.4f%% above maximum %.4f%%",
                    slDistance, config.maxStopLossDistancePercent()));
        }

        // ═══════════════════════════════════════════════════════════════
        // 6. Lifetime
        // ═══════════════════════════════════════════════════════════════

        int minutes = proposal.minuteEstimatedTime();
        if (minutes <= 0) {
            return ValidationResult.fail(ValidationErrorCode.INVALID_LIFETIME,
                "minuteEstimatedTime must be positive, got " + minutes);
        }
        if (minutes > config.maxSignalLifetimeMinutes()) {
            return ValidationResult.fail(ValidationErrorCode.LIFETIME_TOO_LONG,
                String.format("minuteEstimatedTime %d exceeds maximum %d",
                    minutes, config.maxSignalLifetimeMinutes()));
        }

        return ValidationResult.pass();
    }

    private static ValidationResult checkPrice(String field, double value) {
        if (!Double.isFinite(value)) {
            return ValidationResult.fail(ValidationErrorCode.NON_FINITE_PRICE, field + " is not finite: " + value);
        }
        if (value <= 0) {
            return ValidationResult.fail(ValidationErrorCode.NON_POSITIVE_PRICE, field + " must be positive: " + value);
        }
        return null;
    }

    private SignalValidator() {}
}
