package in.tickforge.infrastructure.metrics;

import in.tickforge.domain.signal.CloseReason;
import in.tickforge.domain.tick.TickAction;

import java.time.Duration;

/**
 * Signal engine metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Tick outcomes per strategy
 * - Close reasons and realized P&L
 * - Validation/admission rejections
 * - Recoverable and fatal faults
 * - Generator and persistence latency
 */
public interface EngineMetrics {

    void recordTick(String strategy, TickAction action);

    void recordClose(String strategy, CloseReason reason, double pnlPercent);

    /**
     * @param code validation error code or {@code ADMISSION}
     */
    void recordRejection(String strategy, String code);

    void recordFault(String strategy, boolean fatal);

    void recordGeneration(String strategy, Duration latency);

    void recordPersistenceWrite(String entity, Duration latency);

    /**
     * Adjust the number of live (open or scheduled) positions of a strategy.
     */
    void adjustLivePositions(String strategy, int delta);

    static EngineMetrics noop() {
        return NoopEngineMetrics.INSTANCE;
    }

    final class NoopEngineMetrics implements EngineMetrics {
        private static final NoopEngineMetrics INSTANCE = new NoopEngineMetrics();

        private NoopEngineMetrics() {}

        @Override public void recordTick(String strategy, TickAction action) {}
        @Override public void recordClose(String strategy, CloseReason reason, double pnlPercent) {}
        @Override public void recordRejection(String strategy, String code) {}
        @Override public void recordFault(String strategy, boolean fatal) {}
        @Override public void recordGeneration(String strategy, Duration latency) {}
        @Override public void recordPersistenceWrite(String entity, Duration latency) {}
        @Override public void adjustLivePositions(String strategy, int delta) {}
    }
}
