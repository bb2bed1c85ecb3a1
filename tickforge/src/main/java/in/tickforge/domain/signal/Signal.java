package in.tickforge.domain.signal;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;

/**
 * Durable record of one open or scheduled trade.
 *
 * Invariant (checked on creation and on restore):
 * LONG  ⇒ stopLoss < entry < takeProfit
 * SHORT ⇒ takeProfit < entry < stopLoss
 * and every price is finite and strictly positive.
 *
 * {@code priceTakeProfit}/{@code priceStopLoss} are the effective levels and may be moved
 * by the trailing-stop command; the {@code original*} fields never change.
 */
public record Signal(
    String id,
    String symbol,
    String strategyName,
    String exchangeName,
    Direction direction,

    // Prices
    double priceOpen,
    double priceTakeProfit,
    double priceStopLoss,
    double originalPriceTakeProfit,
    double originalPriceStopLoss,

    // Timing
    int minuteEstimatedTime,
    Instant scheduledAt,   // When the signal was created
    Instant pendingAt,     // When the position became active (equals scheduledAt for immediate entries)

    boolean scheduled,     // true while waiting for the entry price
    String note
) {
    @JsonIgnore
    public SignalKey key() {
        return new SignalKey(symbol, strategyName, exchangeName);
    }

    @JsonIgnore
    public boolean isLong() {
        return direction == Direction.LONG;
    }

    /**
     * Instant at which the position expires by lifetime.
     */
    @JsonIgnore
    public Instant expiresAt() {
        return pendingAt.plus(Duration.ofMinutes(minuteEstimatedTime));
    }

    /**
     * Turn a scheduled order into an open position.
     */
    public Signal activate(Instant activatedAt) {
        return new Signal(id, symbol, strategyName, exchangeName, direction,
            priceOpen, priceTakeProfit, priceStopLoss, originalPriceTakeProfit, originalPriceStopLoss,
            minuteEstimatedTime, scheduledAt, activatedAt, false, note);
    }

    /**
     * Copy with a moved effective stop-loss.
     */
    public Signal withStopLoss(double newStopLoss) {
        return new Signal(id, symbol, strategyName, exchangeName, direction,
            priceOpen, priceTakeProfit, newStopLoss, originalPriceTakeProfit, originalPriceStopLoss,
            minuteEstimatedTime, scheduledAt, pendingAt, scheduled, note);
    }

    /**
     * Check the directional price ordering and positivity of every price.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        if (id == null || id.isEmpty() || direction == null || scheduledAt == null || pendingAt == null) {
            return false;
        }
        if (!positive(priceOpen) || !positive(priceTakeProfit) || !positive(priceStopLoss)
            || !positive(originalPriceTakeProfit) || !positive(originalPriceStopLoss)) {
            return false;
        }
        if (minuteEstimatedTime <= 0) {
            return false;
        }
        if (isLong()) {
            return priceStopLoss < priceOpen && priceOpen < priceTakeProfit
                && originalPriceStopLoss < priceOpen && priceOpen < originalPriceTakeProfit;
        }
        return priceTakeProfit < priceOpen && priceOpen < priceStopLoss
            && originalPriceTakeProfit < priceOpen && priceOpen < originalPriceStopLoss;
    }

    private static boolean positive(double value) {
        return Double.isFinite(value) && value > 0;
    }
}
