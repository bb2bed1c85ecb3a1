package in.tickforge.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {

    @AfterEach
    void tearDown() {
        ConfigRegistry.reset();
    }

    @Test
    @DisplayName("Defaults pass validation")
    void defaultsAreValid() {
        assertTrue(ConfigValidator.collectErrors(EngineConfig.defaults()).isEmpty());
        assertDoesNotThrow(() -> ConfigValidator.validate(EngineConfig.defaults()));
    }

    @Test
    @DisplayName("Take-profit floor below round-trip cost is refused")
    void takeProfitBelowTradingCost() {
        EngineConfig config = EngineConfig.builder()
            .minTakeProfitDistancePercent(0.3)
            .build();

        List<String> errors = ConfigValidator.collectErrors(config);

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("too low to cover trading costs"), errors.get(0));
        assertTrue(errors.get(0).contains("0.40%"), "Required cost is fee x2 + slippage x2");
    }

    @Test
    @DisplayName("All violations are reported together")
    void collectsEveryViolation() {
        EngineConfig config = EngineConfig.builder()
            .percentFee(-1)
            .minStopLossDistancePercent(30)
            .scheduleAwaitMinutes(0)
            .avgPriceCandlesCount(0)
            .candleRetryCount(-1)
            .build();

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> ConfigValidator.validate(config));

        String message = e.getMessage();
        assertTrue(message.startsWith("Engine config validation failed:"));
        assertTrue(message.contains("percentFee"));
        assertTrue(message.contains("must be less than maxStopLossDistancePercent"));
        assertTrue(message.contains("scheduleAwaitMinutes"));
        assertTrue(message.contains("avgPriceCandlesCount"));
        assertTrue(message.contains("candleRetryCount"));
        assertTrue(message.contains("5. "), "Errors are numbered");
    }

    @Test
    void nonFiniteValuesAreRefused() {
        EngineConfig config = EngineConfig.builder()
            .percentSlippage(Double.NaN)
            .maxStopLossDistancePercent(Double.POSITIVE_INFINITY)
            .build();

        List<String> errors = ConfigValidator.collectErrors(config);

        assertTrue(errors.stream().anyMatch(e -> e.startsWith("percentSlippage")));
        assertTrue(errors.stream().anyMatch(e -> e.startsWith("maxStopLossDistancePercent")));
    }

    @Test
    @DisplayName("Registry keeps the previous config when a replacement is invalid")
    void registryRejectsInvalidReplacement() {
        EngineConfig valid = EngineConfig.builder().scheduleAwaitMinutes(30).build();
        ConfigRegistry.set(valid);

        assertThrows(IllegalStateException.class,
            () -> ConfigRegistry.set(valid.toBuilder().maxSignalGenerationSeconds(0).build()));

        assertSame(valid, ConfigRegistry.current());
        assertEquals(30, ConfigRegistry.supplier().get().scheduleAwaitMinutes());

        EngineConfig updated = ConfigRegistry.update(c -> c.toBuilder().scheduleAwaitMinutes(45).build());
        assertEquals(45, updated.scheduleAwaitMinutes());
        assertSame(updated, ConfigRegistry.current());
    }
}
