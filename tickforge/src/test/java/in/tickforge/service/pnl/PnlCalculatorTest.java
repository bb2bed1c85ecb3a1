package in.tickforge.service.pnl;

import in.tickforge.config.EngineConfig;
import in.tickforge.domain.signal.Direction;
import in.tickforge.domain.signal.ProfitLoss;
import in.tickforge.domain.signal.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PnlCalculatorTest {

    private static final EngineConfig CONFIG = EngineConfig.defaults();
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Signal signal(Direction direction, double entry, double tp, double sl) {
        return new Signal("s-1", "BTCUSDT", "test", "binance", direction,
            entry, tp, sl, tp, sl, 60, T0, T0, false, null);
    }

    @Test
    @DisplayName("Long 100 -> 110 nets ~9.58% after slippage and fees")
    void longProfit() {
        ProfitLoss pnl = PnlCalculator.calculate(signal(Direction.LONG, 100, 120, 90), 110, CONFIG);

        assertEquals(9.58022, pnl.pnlPercent(), 1e-5);
        assertEquals(100, pnl.priceOpen());
        assertEquals(110, pnl.priceClose());
    }

    @Test
    void shortProfit() {
        ProfitLoss pnl = PnlCalculator.calculate(signal(Direction.SHORT, 100, 80, 110), 90, CONFIG);

        assertEquals(9.61982, pnl.pnlPercent(), 1e-5);
    }

    @Test
    @DisplayName("Flat exit loses the round-trip cost")
    void flatExitCostsFeesAndSlippage() {
        ProfitLoss pnl = PnlCalculator.calculate(signal(Direction.LONG, 100, 120, 90), 100, CONFIG);

        assertEquals(-0.3998, pnl.pnlPercent(), 1e-4);
    }

    @Test
    void zeroCostsGiveRawMove() {
        EngineConfig free = CONFIG.toBuilder().percentFee(0).percentSlippage(0).build();

        assertEquals(-10.0, PnlCalculator.calculate(signal(Direction.LONG, 100, 120, 90), 90, free).pnlPercent(), 1e-9);
        assertEquals(-10.0, PnlCalculator.calculate(signal(Direction.SHORT, 100, 80, 110), 110, free).pnlPercent(), 1e-9);
    }

    @Test
    void progressTowardsLevels() {
        Signal longSignal = signal(Direction.LONG, 50_000, 51_000, 49_000);

        assertEquals(50.0, PnlCalculator.percentTp(longSignal, 50_500), 1e-9);
        assertEquals(25.0, PnlCalculator.percentSl(longSignal, 49_750), 1e-9);
        assertTrue(PnlCalculator.percentTp(longSignal, 49_750) < 0);

        Signal shortSignal = signal(Direction.SHORT, 50_000, 49_000, 51_000);
        assertEquals(50.0, PnlCalculator.percentTp(shortSignal, 49_500), 1e-9);
        assertEquals(100.0, PnlCalculator.percentSl(shortSignal, 51_000), 1e-9);
    }
}
