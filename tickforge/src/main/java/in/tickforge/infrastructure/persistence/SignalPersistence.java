package in.tickforge.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalKey;
import in.tickforge.exception.PersistenceException;
import in.tickforge.infrastructure.common.RetryPolicy;
import in.tickforge.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Durable state of one key: the open position ("signal" slot) and the scheduled order
 * ("schedule" slot). Each slot holds a JSON signal or the JSON literal {@code null}.
 */
public final class SignalPersistence {
    private static final Logger log = LoggerFactory.getLogger(SignalPersistence.class);

    public static final String SIGNAL_ENTITY = "signal";
    public static final String SCHEDULE_ENTITY = "schedule";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final SignalStore store;
    private final EngineMetrics metrics;
    private final RetryPolicy.Sleeper sleeper;

    public SignalPersistence(SignalStore store, EngineMetrics metrics) {
        this(store, metrics, Thread::sleep);
    }

    public SignalPersistence(SignalStore store, EngineMetrics metrics, RetryPolicy.Sleeper sleeper) {
        this.store = store;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    /**
     * What {@link #restore(SignalKey)} found for a key. Either field may be null.
     */
    public record Restored(Signal signal, Signal scheduled) {
        public boolean isEmpty() {
            return signal == null && scheduled == null;
        }
    }

    public void writeSignal(SignalKey key, Signal signal) {
        write(SIGNAL_ENTITY, key, signal);
    }

    public void writeSchedule(SignalKey key, Signal scheduled) {
        write(SCHEDULE_ENTITY, key, scheduled);
    }

    /**
     * Read both slots of a key.
     *
     * Records that cannot be parsed, or that break the price ordering, are deleted (bounded
     * retry) and treated as absent. Records belonging to another symbol, strategy or exchange
     * are ignored and left in place.
     */
    public Restored restore(SignalKey key) {
        Signal signal = readSlot(SIGNAL_ENTITY, key, false);
        Signal scheduled = readSlot(SCHEDULE_ENTITY, key, true);
        if (signal != null || scheduled != null) {
            log.info("[RESTORE] {} signal={} scheduled={}", key,
                signal != null ? signal.id() : "-", scheduled != null ? scheduled.id() : "-");
        }
        return new Restored(signal, scheduled);
    }

    private void write(String entity, SignalKey key, Signal value) {
        String payload;
        try {
            payload = MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException(entity, key.storageKey(), "Failed to serialize signal state", e);
        }
        long start = System.nanoTime();
        store.write(entity, key.storageKey(), payload);
        metrics.recordPersistenceWrite(entity, Duration.ofNanos(System.nanoTime() - start));
        log.debug("Persisted {} {} ({})", entity, key, value != null ? value.id() : "null");
    }

    private Signal readSlot(String entity, SignalKey key, boolean expectScheduled) {
        String storageKey = key.storageKey();
        String payload = store.read(entity, storageKey);
        if (payload == null) {
            return null;
        }

        Signal signal;
        try {
            signal = MAPPER.readValue(payload, Signal.class);
        } catch (JsonProcessingException e) {
            log.warn("[RESTORE] Corrupt {} record {}: {}", entity, storageKey, e.getOriginalMessage());
            removeCorrupt(entity, storageKey);
            return null;
        }
        if (signal == null) {
            return null;
        }
        if (!signal.isWellFormed() || signal.scheduled() != expectScheduled) {
            log.warn("[RESTORE] Invalid {} record {} (id {})", entity, storageKey, signal.id());
            removeCorrupt(entity, storageKey);
            return null;
        }
        if (!signal.key().equals(key)) {
            log.warn("[RESTORE] Ignoring {} record {}: belongs to {}, not {}", entity, storageKey, signal.key(), key);
            return null;
        }
        return signal;
    }

    private void removeCorrupt(String entity, String storageKey) {
        RetryPolicy policy = RetryPolicy.forRecordRemoval();
        try {
            policy.execute(() -> {
                store.delete(entity, storageKey);
                return null;
            }, sleeper);
            log.info("[RESTORE] Removed corrupt {} record {}", entity, storageKey);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[RESTORE] Interrupted while removing {} record {}", entity, storageKey);
        } catch (Exception e) {
            log.error("[RESTORE] Could not remove corrupt {} record {} after {} attempts: {}",
                entity, storageKey, policy.getAttemptCount(), e.getMessage());
        }
    }
}
