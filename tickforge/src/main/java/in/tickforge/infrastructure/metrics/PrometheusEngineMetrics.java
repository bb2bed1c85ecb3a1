package in.tickforge.infrastructure.metrics;

import in.tickforge.domain.signal.CloseReason;
import in.tickforge.domain.tick.TickAction;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of EngineMetrics.
 *
 * Key Metrics:
 * - tickforge_ticks_total{strategy, action}
 * - tickforge_closes_total{strategy, reason}
 * - tickforge_close_pnl_percent{strategy}
 * - tickforge_rejections_total{strategy, code}
 * - tickforge_faults_total{strategy, severity}
 * - tickforge_generation_seconds{strategy}
 * - tickforge_persistence_write_seconds{entity}
 * - tickforge_live_positions{strategy}
 */
public class PrometheusEngineMetrics implements EngineMetrics {

    private final CollectorRegistry registry;

    private final Counter tickCounter;
    private final Counter closeCounter;
    private final Histogram closePnl;
    private final Counter rejectionCounter;
    private final Counter faultCounter;
    private final Histogram generationLatency;
    private final Histogram persistenceLatency;
    private final Gauge livePositions;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.tickCounter = Counter.build()
            .name("tickforge_ticks_total")
            .help("Evaluations by resulting action")
            .labelNames("strategy", "action")
            .register(registry);

        this.closeCounter = Counter.build()
            .name("tickforge_closes_total")
            .help("Closed positions by reason")
            .labelNames("strategy", "reason")
            .register(registry);

        this.closePnl = Histogram.build()
            .name("tickforge_close_pnl_percent")
            .help("Realized P&L of closed positions in percent")
            .labelNames("strategy")
            .buckets(-20, -5, -2, -1, -0.5, 0, 0.5, 1, 2, 5, 20)
            .register(registry);

        this.rejectionCounter = Counter.build()
            .name("tickforge_rejections_total")
            .help("Rejected proposals and activations by code")
            .labelNames("strategy", "code")
            .register(registry);

        this.faultCounter = Counter.build()
            .name("tickforge_faults_total")
            .help("Engine faults by severity")
            .labelNames("strategy", "severity")
            .register(registry);

        this.generationLatency = Histogram.build()
            .name("tickforge_generation_seconds")
            .help("Signal generator latency in seconds")
            .labelNames("strategy")
            .buckets(0.001, 0.01, 0.1, 0.5, 1.0, 5.0, 30.0, 180.0)
            .register(registry);

        this.persistenceLatency = Histogram.build()
            .name("tickforge_persistence_write_seconds")
            .help("Durable write latency in seconds")
            .labelNames("entity")
            .buckets(0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0)
            .register(registry);

        this.livePositions = Gauge.build()
            .name("tickforge_live_positions")
            .help("Open or scheduled positions")
            .labelNames("strategy")
            .register(registry);
    }

    @Override
    public void recordTick(String strategy, TickAction action) {
        tickCounter.labels(strategy, action.name()).inc();
    }

    @Override
    public void recordClose(String strategy, CloseReason reason, double pnlPercent) {
        closeCounter.labels(strategy, reason.name()).inc();
        closePnl.labels(strategy).observe(pnlPercent);
    }

    @Override
    public void recordRejection(String strategy, String code) {
        rejectionCounter.labels(strategy, code).inc();
    }

    @Override
    public void recordFault(String strategy, boolean fatal) {
        faultCounter.labels(strategy, fatal ? "fatal" : "recoverable").inc();
    }

    @Override
    public void recordGeneration(String strategy, Duration latency) {
        generationLatency.labels(strategy).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordPersistenceWrite(String entity, Duration latency) {
        persistenceLatency.labels(entity).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void adjustLivePositions(String strategy, int delta) {
        livePositions.labels(strategy).inc(delta);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
