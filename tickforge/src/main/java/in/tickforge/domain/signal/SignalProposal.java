package in.tickforge.domain.signal;

/**
 * Trade proposal produced by strategy logic. Consumed immediately by the validator.
 *
 * @param id                  optional id (generated when null)
 * @param direction           LONG or SHORT
 * @param priceOpen           entry price, null for immediate market entry
 * @param priceTakeProfit     take-profit price
 * @param priceStopLoss       stop-loss price
 * @param minuteEstimatedTime expected lifetime in minutes before time expiry
 * @param note                free-form description
 */
public record SignalProposal(
    String id,
    Direction direction,
    Double priceOpen,
    Double priceTakeProfit,
    Double priceStopLoss,
    Integer minuteEstimatedTime,
    String note
) {
    public static SignalProposal market(Direction direction, double tp, double sl, int minutes) {
        return new SignalProposal(null, direction, null, tp, sl, minutes, null);
    }

    public static SignalProposal limit(Direction direction, double entry, double tp, double sl, int minutes) {
        return new SignalProposal(null, direction, entry, tp, sl, minutes, null);
    }

    public boolean hasEntryPrice() {
        return priceOpen != null;
    }

    public SignalProposal withNote(String note) {
        return new SignalProposal(id, direction, priceOpen, priceTakeProfit, priceStopLoss, minuteEstimatedTime, note);
    }
}
