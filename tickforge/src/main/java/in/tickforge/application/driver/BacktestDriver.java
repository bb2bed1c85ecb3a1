package in.tickforge.application.driver;

import in.tickforge.config.EngineConfig;
import in.tickforge.domain.market.Candle;
import in.tickforge.domain.market.CandleInterval;
import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalKey;
import in.tickforge.domain.tick.OpenedResult;
import in.tickforge.domain.tick.ScheduledResult;
import in.tickforge.domain.tick.TickResult;
import in.tickforge.service.price.PriceOracle;
import in.tickforge.service.strategy.SignalStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Backtest Driver.
 * Walks a timeline of instants. After a tick that opens or schedules a position it pre-fetches
 * the bars that position can live through and fast-forwards over them; the timeline then
 * resumes after the last evaluated bar. Runs on the caller's thread; faults propagate.
 */
public final class BacktestDriver {
    private static final Logger log = LoggerFactory.getLogger(BacktestDriver.class);

    private final PriceOracle oracle;
    private final Supplier<EngineConfig> config;

    public BacktestDriver(PriceOracle oracle, Supplier<EngineConfig> config) {
        this.oracle = oracle;
        this.config = config;
    }

    /**
     * @param timeline instants in ascending order (typically one per minute)
     * @return closed and cancelled results, in order
     */
    public List<TickResult> run(SignalStateMachine machine, List<Instant> timeline) {
        if (!machine.isBacktest()) {
            throw new IllegalArgumentException("State machine is not in backtest mode: " + machine.key());
        }
        SignalKey key = machine.key();
        List<TickResult> terminal = new ArrayList<>();
        int fastForwards = 0;

        int i = 0;
        while (i < timeline.size()) {
            Instant when = timeline.get(i);
            TickResult result = machine.tick(key.symbol(), when);

            if (result.isTerminal()) {
                terminal.add(result);
            }

            if (result instanceof OpenedResult || result instanceof ScheduledResult) {
                List<Candle> bars = prefetch(key, machine, when);
                int window = config.get().avgPriceCandlesCount();
                if (bars.size() >= window) {
                    TickResult ff = machine.fastForward(key.symbol(), bars);
                    fastForwards++;
                    if (ff.isTerminal()) {
                        terminal.add(ff);
                    }
                    log.debug("{} fast-forward over {} bars ended at {} ({})", key, bars.size(), ff.when(), ff.action());
                    // Resume after the last evaluated bar
                    Instant covered = ff.when();
                    while (i < timeline.size() && !timeline.get(i).isAfter(covered)) {
                        i++;
                    }
                    continue;
                }
                log.debug("{} only {} bars after {}, ticking instead", key, bars.size(), when);
            }
            i++;
        }

        log.info("[BACKTEST] {} finished: {} ticks, {} fast-forwards, {} terminal results",
            key, timeline.size(), fastForwards, terminal.size());
        return terminal;
    }

    private List<Candle> prefetch(SignalKey key, SignalStateMachine machine, Instant when) {
        EngineConfig cfg = config.get();
        int warmup = cfg.avgPriceCandlesCount() - 1;

        Signal signal = machine.pendingSignal().or(machine::scheduledSignal)
            .orElseThrow(() -> new IllegalStateException("No position after open/schedule for " + key));
        long minutes = signal.minuteEstimatedTime();
        if (signal.scheduled()) {
            minutes += cfg.scheduleAwaitMinutes();
        }

        Instant since = when.minus(Duration.ofMinutes(warmup));
        int limit = (int) (warmup + minutes + 1);
        return oracle.getNextBars(key.symbol(), CandleInterval.MINUTE_1, since, limit);
    }
}
