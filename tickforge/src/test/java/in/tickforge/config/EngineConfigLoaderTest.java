package in.tickforge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty("TF_SCHEDULE_AWAIT_MINUTES");
        System.clearProperty("TF_PERCENT_FEE");
    }

    @Test
    void mergeOverlaysOnlyPresentFields() throws Exception {
        EngineConfig merged = EngineConfigLoader.merge(EngineConfig.defaults(),
            new ObjectMapper().readTree("{\"scheduleAwaitMinutes\": 15, \"percentFee\": 0.05}"));

        assertEquals(15, merged.scheduleAwaitMinutes());
        assertEquals(0.05, merged.percentFee());
        assertEquals(EngineConfig.defaults().avgPriceCandlesCount(), merged.avgPriceCandlesCount());
        assertEquals(EngineConfig.defaults().maxStopLossDistancePercent(), merged.maxStopLossDistancePercent());
    }

    @Test
    void missingFileFallsBackToDefaults() {
        assertEquals(EngineConfig.defaults(), EngineConfigLoader.readFile(tempDir.resolve("absent.json")));
    }

    @Test
    void unreadableFileFails() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> EngineConfigLoader.readFile(file));
        assertTrue(e.getMessage().startsWith("Failed to read engine config"));
    }

    @Test
    void environmentOverridesFile() throws Exception {
        Path file = tempDir.resolve("engine.json");
        Files.writeString(file, "{\"scheduleAwaitMinutes\": 15, \"avgPriceCandlesCount\": 3}");
        System.setProperty("TF_SCHEDULE_AWAIT_MINUTES", "60");

        EngineConfig config = EngineConfigLoader.load(file);

        assertEquals(60, config.scheduleAwaitMinutes(), "Environment wins over the file");
        assertEquals(3, config.avgPriceCandlesCount());
    }

    @Test
    void invalidResultIsRefused() {
        System.setProperty("TF_PERCENT_FEE", "1.0");

        assertThrows(IllegalStateException.class, () -> EngineConfigLoader.load(null),
            "Fee of 1% pushes the round-trip cost above the take-profit floor");
    }
}
