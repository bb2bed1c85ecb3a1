package in.tickforge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Process-wide default {@link EngineConfig}.
 *
 * State machines built without an explicit config read {@link #current()} on every
 * evaluation. Replacements are validated before they become visible.
 */
public final class ConfigRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConfigRegistry.class);

    private static final AtomicReference<EngineConfig> CURRENT = new AtomicReference<>(EngineConfig.defaults());

    public static EngineConfig current() {
        return CURRENT.get();
    }

    /**
     * Supplier view, suitable for injection into a state machine.
     */
    public static Supplier<EngineConfig> supplier() {
        return ConfigRegistry::current;
    }

    /**
     * Replace the process-wide config.
     *
     * @throws IllegalStateException if the new config is invalid (the old one stays in place)
     */
    public static void set(EngineConfig config) {
        Objects.requireNonNull(config, "config");
        ConfigValidator.validate(config);
        EngineConfig previous = CURRENT.getAndSet(config);
        log.info("Engine config replaced: {} -> {}", previous, config);
    }

    /**
     * Apply a modification to the current config.
     */
    public static EngineConfig update(UnaryOperator<EngineConfig> change) {
        while (true) {
            EngineConfig previous = CURRENT.get();
            EngineConfig next = change.apply(previous);
            ConfigValidator.validate(next);
            if (CURRENT.compareAndSet(previous, next)) {
                log.info("Engine config updated: {}", next);
                return next;
            }
        }
    }

    /**
     * Restore defaults (tests).
     */
    public static void reset() {
        CURRENT.set(EngineConfig.defaults());
    }

    private ConfigRegistry() {}
}
