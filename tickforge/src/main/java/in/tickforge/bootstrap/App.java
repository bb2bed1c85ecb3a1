package in.tickforge.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.tickforge.application.driver.LiveDriver;
import in.tickforge.config.ConfigRegistry;
import in.tickforge.config.EngineConfig;
import in.tickforge.config.EngineConfigLoader;
import in.tickforge.domain.signal.SignalInterval;
import in.tickforge.domain.signal.SignalKey;
import in.tickforge.infrastructure.metrics.PrometheusEngineMetrics;
import in.tickforge.infrastructure.metrics.PrometheusMetricsHandler;
import in.tickforge.infrastructure.persistence.FileSignalStore;
import in.tickforge.infrastructure.persistence.PostgresSignalStore;
import in.tickforge.infrastructure.persistence.SignalPersistence;
import in.tickforge.infrastructure.persistence.SignalStore;
import in.tickforge.service.core.SignalEventBus;
import in.tickforge.service.price.PriceOracle;
import in.tickforge.service.price.RetryingPriceOracle;
import in.tickforge.service.risk.AdmissionGate;
import in.tickforge.service.strategy.SignalGenerator;
import in.tickforge.service.strategy.SignalStateMachine;
import in.tickforge.util.Env;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * TickForge bootstrap.
 *
 * Environment:
 * - TF_CONFIG_FILE   JSON engine config (optional, any subset of fields)
 * - TF_STORE         file | postgres (default file)
 * - TF_DATA_DIR      base directory of the file store (default ./data)
 * - TF_DB_URL, TF_DB_USER, TF_DB_PASS, TF_DB_POOL_SIZE
 * - TF_METRICS_PORT  serve /metrics when set
 * - TF_* engine overrides, see {@link EngineConfigLoader}
 *
 * Strategies and price sources belong to the embedding application, which calls
 * {@link #buildRuntime()} and registers its state machines with {@link EngineRuntime#machine}.
 * {@code main} only validates the environment and reports the effective setup.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== TickForge Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        try (EngineRuntime runtime = buildRuntime()) {
            log.info("✓ Runtime ready (store={}, metrics={})",
                Env.get("TF_STORE", "file"), runtime.metricsServer() != null ? "on" : "off");
            log.info("No strategies registered; embed TickForge and call App.buildRuntime() to run signals");
        }
    }

    /**
     * Load configuration, open the store and wire the shared services.
     */
    public static EngineRuntime buildRuntime() {
        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        String configFile = Env.get("TF_CONFIG_FILE", null);
        EngineConfig config = EngineConfigLoader.load(configFile != null ? Paths.get(configFile) : null);
        ConfigRegistry.set(config);
        log.info("✓ Engine config loaded");

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        CollectorRegistry registry = new CollectorRegistry();
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics(registry);
        Undertow metricsServer = null;
        int metricsPort = Env.getInt("TF_METRICS_PORT", 0);
        if (metricsPort > 0) {
            metricsServer = PrometheusMetricsHandler.server(registry, "0.0.0.0", metricsPort);
            metricsServer.start();
            log.info("✓ Prometheus /metrics endpoint on port {}", metricsPort);
        }

        // ═══════════════════════════════════════════════════════════════
        // Persistence
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = null;
        SignalStore store;
        String storeType = Env.get("TF_STORE", "file");
        switch (storeType) {
            case "postgres" -> {
                dataSource = createDataSource();
                store = new PostgresSignalStore(dataSource);
            }
            case "file" -> store = new FileSignalStore(Path.of(Env.get("TF_DATA_DIR", "./data")));
            default -> throw new IllegalStateException("Unknown TF_STORE: " + storeType);
        }
        store.init();
        SignalPersistence persistence = new SignalPersistence(store, metrics);
        log.info("✓ Signal store initialized ({})", storeType);

        // ═══════════════════════════════════════════════════════════════
        // Events & drivers
        // ═══════════════════════════════════════════════════════════════
        SignalEventBus bus = new SignalEventBus();
        LiveDriver liveDriver = new LiveDriver(bus);

        return new EngineRuntime(persistence, bus, metrics, liveDriver, metricsServer, dataSource);
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("TF_DB_URL", "jdbc:postgresql://localhost:5432/tickforge");
        String user = Env.get("TF_DB_USER", "postgres");
        String pass = Env.get("TF_DB_PASS", "postgres");
        int maxPool = Env.getInt("TF_DB_POOL_SIZE", 4);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("tickforge-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    /**
     * Shared services of a running process.
     */
    public record EngineRuntime(
        SignalPersistence persistence,
        SignalEventBus bus,
        PrometheusEngineMetrics metrics,
        LiveDriver liveDriver,
        Undertow metricsServer,
        HikariDataSource dataSource
    ) implements AutoCloseable {

        /**
         * Live state machine wired to the shared services. Price requests are retried per
         * the current configuration.
         */
        public SignalStateMachine machine(SignalKey key, PriceOracle oracle, SignalGenerator generator,
                                          AdmissionGate gate, SignalInterval interval) {
            return SignalStateMachine.builder(key)
                .oracle(new RetryingPriceOracle(oracle, ConfigRegistry.supplier()))
                .generator(generator)
                .gate(gate)
                .sink(bus)
                .persistence(persistence)
                .metrics(metrics)
                .interval(interval)
                .build();
        }

        @Override
        public void close() {
            liveDriver.close();
            bus.close();
            if (metricsServer != null) {
                metricsServer.stop();
            }
            if (dataSource != null) {
                dataSource.close();
            }
            log.info("TickForge runtime closed");
        }
    }

    private App() {}
}
