package in.tickforge.service.price;

import in.tickforge.domain.market.Candle;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VwapCalculatorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void weightsTypicalPriceByVolume() {
        List<Candle> candles = List.of(
            Candle.of(T0, 10, 12, 8, 10, 1),
            Candle.of(T0.plusSeconds(60), 20, 22, 18, 20, 3));

        // (10 * 1 + 20 * 3) / 4
        assertEquals(17.5, VwapCalculator.calculate(candles), 1e-9);
    }

    @Test
    void zeroVolumeFallsBackToAverageClose() {
        List<Candle> candles = List.of(
            Candle.of(T0, 10, 12, 8, 10, 0),
            Candle.of(T0.plusSeconds(60), 20, 22, 18, 20, 0));

        assertEquals(15.0, VwapCalculator.calculate(candles), 1e-9);
    }

    @Test
    void emptyWindowIsRefused() {
        assertThrows(IllegalArgumentException.class, () -> VwapCalculator.calculate(List.of()));
        assertThrows(IllegalArgumentException.class, () -> VwapCalculator.calculate(null));
    }

    @Test
    void trailingWindowEndsAtIndex() {
        List<Candle> candles = List.of(
            Candle.flat(T0, 100, 1),
            Candle.flat(T0.plusSeconds(60), 200, 1),
            Candle.flat(T0.plusSeconds(120), 300, 1),
            Candle.flat(T0.plusSeconds(180), 400, 1));

        assertEquals(250.0, VwapCalculator.trailing(candles, 2, 2), 1e-9);
        assertEquals(150.0, VwapCalculator.trailing(candles, 1, 5), 1e-9, "Short history uses what exists");
        assertEquals(100.0, VwapCalculator.trailing(candles, 0, 3), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> VwapCalculator.trailing(candles, 3, 0));
    }
}
