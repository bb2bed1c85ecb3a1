package in.tickforge.infrastructure.persistence;

import in.tickforge.domain.signal.Direction;
import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalKey;
import in.tickforge.exception.PersistenceException;
import in.tickforge.infrastructure.metrics.EngineMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SignalPersistenceTest {

    private static final SignalKey KEY = new SignalKey("BTCUSDT", "momentum", "binance");
    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    @TempDir
    Path dir;

    private FileSignalStore store;
    private EngineMetrics metrics;
    private final List<Long> sleeps = new ArrayList<>();
    private SignalPersistence persistence;

    @BeforeEach
    void setUp() {
        store = new FileSignalStore(dir);
        store.init();
        metrics = mock(EngineMetrics.class);
        persistence = new SignalPersistence(store, metrics, sleeps::add);
    }

    private static Signal signal(String symbol, boolean scheduled) {
        return new Signal("sig-1", symbol, "momentum", "binance", Direction.LONG,
            50_000, 51_000, 49_000, 51_000, 49_000, 60, T0, T0.plusSeconds(120), scheduled, "breakout");
    }

    @Test
    void roundTripsBothSlots() {
        Signal open = signal("BTCUSDT", false);
        Signal scheduled = signal("BTCUSDT", true);

        persistence.writeSignal(KEY, open);
        persistence.writeSchedule(KEY, scheduled);
        SignalPersistence.Restored restored = persistence.restore(KEY);

        assertEquals(open, restored.signal());
        assertEquals(scheduled, restored.scheduled());
        assertFalse(restored.isEmpty());
        verify(metrics).recordPersistenceWrite(eq(SignalPersistence.SIGNAL_ENTITY), any(Duration.class));
        verify(metrics).recordPersistenceWrite(eq(SignalPersistence.SCHEDULE_ENTITY), any(Duration.class));
    }

    private static Signal signalFor(SignalKey key, String id) {
        return new Signal(id, key.symbol(), key.strategyName(), key.exchangeName(), Direction.LONG,
            50_000, 51_000, 49_000, 51_000, 49_000, 60, T0, T0.plusSeconds(120), false, "breakout");
    }

    @Test
    @DisplayName("Keys differing only in separator or punctuation keep separate records")
    void similarKeysDoNotShareRecords() {
        SignalKey slash = new SignalKey("BTC/USDT", "momentum", "binance");
        SignalKey dash = new SignalKey("BTC-USDT", "momentum", "binance");
        SignalKey underscoreInStrategy = new SignalKey("ETHUSDT", "mean_rev", "x");
        SignalKey underscoreInExchange = new SignalKey("ETHUSDT", "mean", "rev_x");

        assertNotEquals(slash.storageKey(), dash.storageKey());
        assertNotEquals(underscoreInStrategy.storageKey(), underscoreInExchange.storageKey());

        Signal a = signalFor(slash, "sig-a");
        Signal b = signalFor(dash, "sig-b");
        Signal c = signalFor(underscoreInStrategy, "sig-c");
        Signal d = signalFor(underscoreInExchange, "sig-d");
        persistence.writeSignal(slash, a);
        persistence.writeSignal(dash, b);
        persistence.writeSignal(underscoreInStrategy, c);
        persistence.writeSignal(underscoreInExchange, d);

        assertEquals(a, persistence.restore(slash).signal(), "open position of BTC/USDT must survive");
        assertEquals(b, persistence.restore(dash).signal());
        assertEquals(c, persistence.restore(underscoreInStrategy).signal(), "open position of mean_rev/x must survive");
        assertEquals(d, persistence.restore(underscoreInExchange).signal());
        assertEquals(4, store.keys(SignalPersistence.SIGNAL_ENTITY).size());
    }

    @Test
    void storageKeyIsFileSafe() {
        String storageKey = new SignalKey("BTC/USDT", ".tmp-x", "bin ance").storageKey();

        assertEquals("%2Etmp-x_bin%20ance_BTC%2FUSDT", storageKey);
        assertFalse(AtomicFileWriter.isTempFile(store.path(SignalPersistence.SIGNAL_ENTITY, storageKey)));
    }

    @Test
    void emptySlotIsWrittenAsNull() {
        persistence.writeSignal(KEY, signal("BTCUSDT", false));
        persistence.writeSignal(KEY, null);

        assertEquals("null", store.read(SignalPersistence.SIGNAL_ENTITY, KEY.storageKey()));
        assertTrue(persistence.restore(KEY).isEmpty());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void instantsAreStoredAsIsoText() {
        persistence.writeSignal(KEY, signal("BTCUSDT", false));

        String payload = store.read(SignalPersistence.SIGNAL_ENTITY, KEY.storageKey());
        assertTrue(payload.contains("\"scheduledAt\":\"2024-01-01T10:00:00Z\""), payload);
    }

    @Test
    @DisplayName("Unparseable record is deleted and treated as absent")
    void corruptRecordRemoved() {
        store.write(SignalPersistence.SIGNAL_ENTITY, KEY.storageKey(), "{\"id\": \"sig-1\", \"priceOpen\": ");

        assertNull(persistence.restore(KEY).signal());
        assertNull(store.read(SignalPersistence.SIGNAL_ENTITY, KEY.storageKey()));
    }

    @Test
    @DisplayName("Record breaking the price ordering is deleted")
    void malformedRecordRemoved() {
        Signal broken = new Signal("sig-1", "BTCUSDT", "momentum", "binance", Direction.LONG,
            50_000, 49_000, 51_000, 49_000, 51_000, 60, T0, T0, false, null);
        persistence.writeSignal(KEY, broken);

        assertTrue(persistence.restore(KEY).isEmpty());
        assertNull(store.read(SignalPersistence.SIGNAL_ENTITY, KEY.storageKey()));
    }

    @Test
    void recordInWrongSlotRemoved() {
        persistence.writeSchedule(KEY, signal("BTCUSDT", false));

        assertNull(persistence.restore(KEY).scheduled());
        assertNull(store.read(SignalPersistence.SCHEDULE_ENTITY, KEY.storageKey()));
    }

    @Test
    @DisplayName("Record of another symbol is ignored but kept")
    void identityMismatchKept() {
        persistence.writeSignal(KEY, signal("ETHUSDT", false));

        assertNull(persistence.restore(KEY).signal());
        assertNotNull(store.read(SignalPersistence.SIGNAL_ENTITY, KEY.storageKey()));
    }

    @Test
    @DisplayName("Interrupted write leaves the previous record readable")
    void crashDuringWriteKeepsPreviousRecord() throws Exception {
        Signal original = signal("BTCUSDT", false);
        persistence.writeSignal(KEY, original);
        Path target = store.path(SignalPersistence.SIGNAL_ENTITY, KEY.storageKey());

        AtomicFileWriter.PendingWrite pending = AtomicFileWriter.begin(target, out -> new FilterOutputStream(out) {
            private int written;

            @Override
            public void write(int b) throws IOException {
                if (++written > 10) {
                    throw new IOException("power loss");
                }
                super.write(b);
            }
        });
        assertThrows(IOException.class,
            () -> pending.stream().write("null                ".getBytes(StandardCharsets.UTF_8)));
        // Process dies: the descriptor goes away but nobody cleans up the temp file
        pending.stream().close();

        FileSignalStore reopened = new FileSignalStore(dir);
        reopened.init();
        SignalPersistence.Restored restored = new SignalPersistence(reopened, EngineMetrics.noop()).restore(KEY);

        assertEquals(original, restored.signal());
        assertEquals(List.of(KEY.storageKey()), reopened.keys(SignalPersistence.SIGNAL_ENTITY));
    }

    @Test
    @DisplayName("Failed removal is retried five times, then restore carries on")
    void removalRetriedThenGivenUp() {
        SignalStore failing = mock(SignalStore.class);
        when(failing.read(eq(SignalPersistence.SIGNAL_ENTITY), anyString())).thenReturn("garbage");
        doThrow(new PersistenceException("signal", KEY.storageKey(), "read-only"))
            .when(failing).delete(anyString(), anyString());

        SignalPersistence.Restored restored =
            new SignalPersistence(failing, EngineMetrics.noop(), sleeps::add).restore(KEY);

        assertTrue(restored.isEmpty());
        verify(failing, times(5)).delete(SignalPersistence.SIGNAL_ENTITY, KEY.storageKey());
        assertEquals(List.of(1_000L, 1_000L, 1_000L, 1_000L), sleeps);
    }

    @Test
    void storeFailurePropagates() {
        SignalStore failing = mock(SignalStore.class);
        doThrow(new PersistenceException("signal", KEY.storageKey(), "Failed to write signal state"))
            .when(failing).write(anyString(), anyString(), anyString());

        assertThrows(PersistenceException.class,
            () -> new SignalPersistence(failing, metrics).writeSignal(KEY, signal("BTCUSDT", false)));
        verify(metrics, never()).recordPersistenceWrite(anyString(), any());
    }
}
