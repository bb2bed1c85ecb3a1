package in.tickforge.domain.signal;

/**
 * Realized result of a closed position, net of fees and slippage.
 *
 * @param pnlPercent profit (positive) or loss (negative) in percent of the entry
 * @param priceOpen  entry price before slippage
 * @param priceClose exit price before slippage
 */
public record ProfitLoss(double pnlPercent, double priceOpen, double priceClose) {
}
