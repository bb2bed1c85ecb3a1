package in.tickforge.service.pnl;

import in.tickforge.config.EngineConfig;
import in.tickforge.domain.signal.ProfitLoss;
import in.tickforge.domain.signal.Signal;

/**
 * Realized and unrealized profit/loss of a signal.
 *
 * Slippage moves both fills against the trader:
 * - LONG:  entry × (1 + s), exit × (1 − s)
 * - SHORT: entry × (1 − s), exit × (1 + s)
 * The fee is charged twice (entry and exit) and subtracted from the percentage.
 */
public final class PnlCalculator {

    /**
     * @param signal     position being closed
     * @param priceClose exit price before slippage
     */
    public static ProfitLoss calculate(Signal signal, double priceClose, EngineConfig config) {
        double slippage = config.percentSlippage() / 100.0;
        double entry = signal.priceOpen();

        double fillOpen;
        double fillClose;
        double pnl;
        if (signal.isLong()) {
            fillOpen = entry * (1 + slippage);
            fillClose = priceClose * (1 - slippage);
            pnl = (fillClose - fillOpen) / fillOpen * 100.0;
        } else {
            fillOpen = entry * (1 - slippage);
            fillClose = priceClose * (1 + slippage);
            pnl = (fillOpen - fillClose) / fillOpen * 100.0;
        }

        pnl -= config.percentFee() * 2;
        return new ProfitLoss(pnl, entry, priceClose);
    }

    /**
     * Progress from entry towards take-profit in percent (0 at entry, 100 at TP). Negative when
     * the price moved the other way.
     */
    public static double percentTp(Signal signal, double currentPrice) {
        double total = signal.priceTakeProfit() - signal.priceOpen();
        return (currentPrice - signal.priceOpen()) / total * 100.0;
    }

    /**
     * Progress from entry towards stop-loss in percent (0 at entry, 100 at SL).
     */
    public static double percentSl(Signal signal, double currentPrice) {
        double total = signal.priceStopLoss() - signal.priceOpen();
        return (currentPrice - signal.priceOpen()) / total * 100.0;
    }

    private PnlCalculator() {}
}
