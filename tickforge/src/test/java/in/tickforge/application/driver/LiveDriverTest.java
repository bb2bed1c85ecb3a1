package in.tickforge.application.driver;

import in.tickforge.config.EngineConfig;
import in.tickforge.domain.event.FaultEvent;
import in.tickforge.domain.market.Candle;
import in.tickforge.domain.signal.Direction;
import in.tickforge.domain.signal.SignalKey;
import in.tickforge.domain.signal.SignalProposal;
import in.tickforge.domain.tick.IdleReason;
import in.tickforge.domain.tick.IdleResult;
import in.tickforge.exception.MissingPriceDataException;
import in.tickforge.exception.PersistenceException;
import in.tickforge.exception.PriceOracleException;
import in.tickforge.exception.SignalGenerationTimeoutException;
import in.tickforge.service.core.EventSink;
import in.tickforge.service.price.HistoricalPriceOracle;
import in.tickforge.service.strategy.SignalStateMachine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LiveDriverTest {

    private static final SignalKey KEY = new SignalKey("BTCUSDT", "momentum", "binance");
    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");
    private static final Duration EVERY = Duration.ofMillis(20);

    @Mock
    private SignalStateMachine machine;
    @Mock
    private EventSink sink;

    private LiveDriver driver;

    @BeforeEach
    void setUp() {
        lenient().when(machine.key()).thenReturn(KEY);
        lenient().when(machine.isBacktest()).thenReturn(false);
        lenient().when(machine.restore()).thenReturn(Optional.empty());
        lenient().when(machine.tick(eq("BTCUSDT"), any())).thenReturn(new IdleResult(KEY, NOW, IdleReason.NO_SIGNAL));
        driver = new LiveDriver(sink, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        driver.close();
    }

    @Test
    void restoresThenTicks() {
        driver.start(machine, EVERY);

        verify(machine, timeout(1_000)).restore();
        verify(machine, timeout(1_000).atLeast(3)).tick("BTCUSDT", NOW);
        assertTrue(driver.isRunning(KEY));

        driver.close();
        assertFalse(driver.isRunning(KEY));
        verify(machine).close();
    }

    @Test
    void refusesBacktestMachineAndDuplicates() {
        when(machine.isBacktest()).thenReturn(true);
        assertThrows(IllegalArgumentException.class, () -> driver.start(machine, EVERY));

        when(machine.isBacktest()).thenReturn(false);
        driver.start(machine, EVERY);
        assertThrows(IllegalStateException.class, () -> driver.start(machine, EVERY));
    }

    @Test
    @DisplayName("Fatal fault is published and ends the loop")
    void fatalFaultEndsLoop() throws Exception {
        when(machine.tick(eq("BTCUSDT"), any()))
            .thenThrow(new SignalGenerationTimeoutException(KEY.toString(), Duration.ofSeconds(180)));

        driver.start(machine, EVERY);

        assertTrue(driver.awaitTermination(KEY, Duration.ofSeconds(2)));
        ArgumentCaptor<FaultEvent> captor = ArgumentCaptor.forClass(FaultEvent.class);
        verify(sink).publishFault(captor.capture());
        assertTrue(captor.getValue().fatal());
        assertEquals(KEY, captor.getValue().key());
        assertInstanceOf(SignalGenerationTimeoutException.class, captor.getValue().error());
        verify(machine, times(1)).tick(any(), any());
    }

    @Test
    @DisplayName("Recoverable fault is published and the loop carries on")
    void recoverableFaultKeepsLooping() {
        when(machine.tick(eq("BTCUSDT"), any()))
            .thenThrow(new PriceOracleException("BTCUSDT", "Failed to getBars after 4 attempts"))
            .thenReturn(new IdleResult(KEY, NOW, IdleReason.NO_SIGNAL));

        driver.start(machine, EVERY);

        verify(machine, timeout(1_000).atLeast(3)).tick(any(), any());
        ArgumentCaptor<FaultEvent> captor = ArgumentCaptor.forClass(FaultEvent.class);
        verify(sink).publishFault(captor.capture());
        assertFalse(captor.getValue().fatal());
        assertTrue(driver.isRunning(KEY));
    }

    @Test
    @DisplayName("Oracle without bars stops the key")
    void missingPriceDataEndsLoop() throws Exception {
        HistoricalPriceOracle empty = new HistoricalPriceOracle(Clock.fixed(NOW, ZoneOffset.UTC))
            .load("BTCUSDT", List.of(Candle.flat(NOW.plus(Duration.ofHours(1)), 50_000, 1)));
        SignalStateMachine real = SignalStateMachine.builder(KEY)
            .oracle(empty)
            .generator((symbol, when) -> Optional.of(SignalProposal.market(Direction.LONG, 51_000, 49_000, 60)))
            .sink(sink)
            .config(EngineConfig.defaults())
            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
            .build();

        driver.start(real, EVERY);

        assertTrue(driver.awaitTermination(KEY, Duration.ofSeconds(2)), "loop must end on a fatal fault");
        ArgumentCaptor<FaultEvent> captor = ArgumentCaptor.forClass(FaultEvent.class);
        verify(sink).publishFault(captor.capture());
        assertTrue(captor.getValue().fatal());
        assertInstanceOf(MissingPriceDataException.class, captor.getValue().error());
        assertFalse(driver.isRunning(KEY));
    }

    @Test
    void unexpectedExceptionIsRecoverable() {
        when(machine.tick(eq("BTCUSDT"), any()))
            .thenThrow(new IllegalStateException("bug"))
            .thenReturn(new IdleResult(KEY, NOW, IdleReason.NO_SIGNAL));

        driver.start(machine, EVERY);

        verify(machine, timeout(1_000).atLeast(2)).tick(any(), any());
        verify(sink).publishFault(argThat(fault -> !fault.fatal() && "bug".equals(fault.error().getMessage())));
    }

    @Test
    @DisplayName("Failed restore never starts ticking")
    void restoreFailureIsFatal() throws Exception {
        when(machine.restore()).thenThrow(new PersistenceException("signal", KEY.storageKey(), "Failed to read signal state"));

        driver.start(machine, EVERY);

        assertTrue(driver.awaitTermination(KEY, Duration.ofSeconds(2)));
        verify(sink).publishFault(argThat(FaultEvent::fatal));
        verify(machine, never()).tick(any(), any());
        verify(machine).close();
    }

    @Test
    void stopWithoutPositionEndsAtOnce() throws Exception {
        when(machine.hasPosition()).thenReturn(false);

        driver.start(machine, Duration.ofMinutes(1));
        driver.stop(KEY);

        assertTrue(driver.awaitTermination(KEY, Duration.ofSeconds(2)));
        verify(machine).stop();
        verify(machine, never()).tick(any(), any());
    }

    @Test
    @DisplayName("Stop drains the open position before the loop ends")
    void stopDrainsOpenPosition() throws Exception {
        AtomicBoolean stopped = new AtomicBoolean(false);
        doAnswer(invocation -> {
            stopped.set(true);
            return null;
        }).when(machine).stop();
        when(machine.isStopped()).thenAnswer(invocation -> stopped.get());
        when(machine.hasPosition()).thenReturn(true, false);

        driver.start(machine, EVERY);
        verify(machine, timeout(1_000).atLeast(1)).tick(any(), any());
        driver.stop(KEY);

        assertTrue(driver.awaitTermination(KEY, Duration.ofSeconds(2)));
        verify(machine, atLeast(2)).tick(any(), any());
        verify(machine, times(2)).hasPosition();
    }

    @Test
    void stopUnknownKeyIsIgnored() {
        driver.stop(new SignalKey("ETHUSDT", "momentum", "binance"));

        assertFalse(driver.isRunning(KEY));
    }
}
