package in.tickforge.application.driver;

import in.tickforge.domain.event.FaultEvent;
import in.tickforge.domain.signal.SignalKey;
import in.tickforge.exception.EngineException;
import in.tickforge.service.core.EventSink;
import in.tickforge.service.strategy.SignalStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Live Driver.
 * One single-threaded worker per key: restore durable state, then tick at a fixed interval
 * against the wall clock. Everything a key does (ticks, restore, stop) runs on its worker,
 * which is what serializes access to the state machine.
 *
 * Faults never escape the worker: recoverable ones are published and the loop continues;
 * fatal ones are published and end that key's loop. Other keys are unaffected.
 */
public final class LiveDriver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LiveDriver.class);

    private final EventSink sink;
    private final Clock clock;
    private final Map<SignalKey, Worker> workers = new ConcurrentHashMap<>();

    public LiveDriver(EventSink sink) {
        this(sink, Clock.systemUTC());
    }

    public LiveDriver(EventSink sink, Clock clock) {
        this.sink = sink;
        this.clock = clock;
    }

    /**
     * Start polling a state machine every {@code every}.
     */
    public void start(SignalStateMachine machine, Duration every) {
        if (machine.isBacktest()) {
            throw new IllegalArgumentException("Backtest state machine cannot run live: " + machine.key());
        }
        SignalKey key = machine.key();
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "live-" + key);
            t.setDaemon(true);
            return t;
        });
        Worker worker = new Worker(machine, executor);
        if (workers.putIfAbsent(key, worker) != null) {
            executor.shutdown();
            throw new IllegalStateException("Key already running: " + key);
        }

        executor.execute(() -> restore(worker));
        executor.scheduleAtFixedRate(() -> step(worker), every.toMillis(), every.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[LIVE] {} started, tick every {}", key, every);
    }

    /**
     * Graceful drain: stop generating; the loop ends once the key holds no position.
     */
    public void stop(SignalKey key) {
        Worker worker = workers.get(key);
        if (worker == null) {
            return;
        }
        worker.executor.execute(() -> {
            worker.machine.stop();
            if (!worker.machine.hasPosition()) {
                finish(worker, "stopped");
            }
        });
    }

    public boolean isRunning(SignalKey key) {
        return workers.containsKey(key);
    }

    /**
     * Wait until the key's loop has ended.
     *
     * @return false if it is still running after the timeout
     */
    public boolean awaitTermination(SignalKey key, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (workers.containsKey(key)) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    private void restore(Worker worker) {
        try {
            worker.machine.restore();
        } catch (RuntimeException e) {
            // Ticking without the durable state could open a duplicate position
            log.error("[LIVE] {} restore failed, key not started: {}", worker.machine.key(), e.getMessage(), e);
            sink.publishFault(new FaultEvent(worker.machine.key(), clock.instant(), e, true));
            finish(worker, "restore failed");
        }
    }

    private void step(Worker worker) {
        SignalStateMachine machine = worker.machine;
        SignalKey key = machine.key();
        try {
            machine.tick(key.symbol(), clock.instant());
            if (machine.isStopped() && !machine.hasPosition()) {
                finish(worker, "drained");
            }
        } catch (EngineException e) {
            sink.publishFault(new FaultEvent(key, clock.instant(), e, e.isFatal()));
            if (e.isFatal()) {
                finish(worker, "fatal fault");
            }
        } catch (RuntimeException e) {
            log.error("[LIVE] {} unexpected failure: {}", key, e.getMessage(), e);
            sink.publishFault(new FaultEvent(key, clock.instant(), e, false));
        }
    }

    private void finish(Worker worker, String why) {
        if (workers.remove(worker.machine.key(), worker)) {
            worker.executor.shutdown();
            worker.machine.close();
            log.info("[LIVE] {} loop ended ({})", worker.machine.key(), why);
        }
    }

    /**
     * Stop every loop at once, without draining.
     */
    @Override
    public void close() {
        for (Worker worker : workers.values()) {
            finish(worker, "driver closed");
        }
    }

    private record Worker(SignalStateMachine machine, ScheduledExecutorService executor) {
    }
}
