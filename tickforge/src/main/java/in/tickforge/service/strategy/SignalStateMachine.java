package in.tickforge.service.strategy;

import in.tickforge.config.ConfigRegistry;
import in.tickforge.config.EngineConfig;
import in.tickforge.domain.common.ValidationResult;
import in.tickforge.domain.event.FaultEvent;
import in.tickforge.domain.event.RejectionEvent;
import in.tickforge.domain.market.Candle;
import in.tickforge.domain.risk.AdmissionContext;
import in.tickforge.domain.risk.AdmissionDecision;
import in.tickforge.domain.signal.CancelReason;
import in.tickforge.domain.signal.CloseReason;
import in.tickforge.domain.signal.Direction;
import in.tickforge.domain.signal.ProfitLoss;
import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalInterval;
import in.tickforge.domain.signal.SignalKey;
import in.tickforge.domain.signal.SignalProposal;
import in.tickforge.domain.tick.ActiveResult;
import in.tickforge.domain.tick.CancelledResult;
import in.tickforge.domain.tick.ClosedResult;
import in.tickforge.domain.tick.IdleReason;
import in.tickforge.domain.tick.IdleResult;
import in.tickforge.domain.tick.OpenedResult;
import in.tickforge.domain.tick.ScheduledResult;
import in.tickforge.domain.tick.TickResult;
import in.tickforge.exception.InvariantViolationException;
import in.tickforge.exception.SignalGenerationTimeoutException;
import in.tickforge.infrastructure.metrics.EngineMetrics;
import in.tickforge.infrastructure.persistence.SignalPersistence;
import in.tickforge.service.core.EventSink;
import in.tickforge.service.pnl.PnlCalculator;
import in.tickforge.service.price.PriceOracle;
import in.tickforge.service.price.VwapCalculator;
import in.tickforge.service.risk.AdmissionGate;
import in.tickforge.service.validation.SignalValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Signal State Machine.
 * Owns the lifecycle of at most one open or scheduled signal for one (symbol, strategy, exchange) key.
 *
 * Lifecycle:
 * <pre>
 * IDLE ──generate──► SCHEDULED ──entry reached──► OPENED ──► ACTIVE ──► CLOSED ──► IDLE
 *   │                    └──timeout / SL breach / admission──► CANCELLED | IDLE
 *   └──generate (no entry price, or entry already reached)──► OPENED
 * </pre>
 *
 * {@link #tick} evaluates one step at one instant; {@link #fastForward} evaluates a batch of bars.
 * Both call the same per-step routine, {@link #advance}, so their outcomes cannot drift apart.
 *
 * Not thread-safe: callers serialize tick, fastForward, restore and the commands (stop included)
 * per instance. Different instances are independent.
 */
public final class SignalStateMachine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SignalStateMachine.class);

    private final SignalKey key;
    private final PriceOracle oracle;
    private final SignalGenerator generator;
    private final AdmissionGate gate;
    private final EventSink sink;
    private final SignalPersistence persistence;   // null in backtest mode
    private final Supplier<EngineConfig> config;
    private final EngineMetrics metrics;
    private final SignalInterval interval;
    private final Clock clock;
    private final boolean backtest;

    private ExecutorService generatorExecutor;

    private Signal pendingSignal;      // Open position
    private Signal scheduledSignal;    // Order waiting for its entry price
    private Instant lastGenerationAt;
    private volatile boolean stopped = false;

    private SignalStateMachine(Builder b) {
        this.key = Objects.requireNonNull(b.key, "key");
        this.oracle = Objects.requireNonNull(b.oracle, "oracle");
        this.generator = Objects.requireNonNull(b.generator, "generator");
        this.gate = b.gate;
        this.sink = b.sink;
        this.persistence = b.backtest ? null : b.persistence;
        this.config = b.config;
        this.metrics = b.metrics;
        this.interval = b.interval;
        this.clock = b.clock;
        this.backtest = b.backtest;
        this.generatorExecutor = b.generatorExecutor;
    }

    // ═══════════════════════════════════════════════════════════════
    // TICK
    // ═══════════════════════════════════════════════════════════════

    /**
     * Evaluate one step at {@code when}.
     *
     * @throws SignalGenerationTimeoutException if the generator does not answer in time (fatal)
     * @throws in.tickforge.exception.PriceOracleException if no reference price can be obtained
     * @throws in.tickforge.exception.MissingPriceDataException if the oracle has no bars (fatal)
     */
    public TickResult tick(String symbol, Instant when) {
        requireSymbol(symbol);
        EngineConfig cfg = config.get();

        if (scheduledSignal != null || pendingSignal != null) {
            double price = oracle.getReferencePrice(symbol, when, cfg.avgPriceCandlesCount());
            return emit(advance(price, when, cfg));
        }

        if (stopped) {
            return emit(new IdleResult(key, when, IdleReason.STOPPED));
        }

        return emit(generate(symbol, when, cfg));
    }

    // ═══════════════════════════════════════════════════════════════
    // FAST-FORWARD
    // ═══════════════════════════════════════════════════════════════

    /**
     * Advance the current open or scheduled signal over a batch of one-minute bars.
     *
     * The first {@code avgPriceCandlesCount - 1} bars only warm up the VWAP window; every
     * later bar is one step evaluated at its close time. Stops at the first terminal result.
     * When the bars run out first, the last non-terminal result is returned and the signal
     * stays in place for further bars or ticks.
     *
     * Never calls the signal generator. Intermediate active results are not published;
     * an activation and a returned terminal or idle result are.
     *
     * @throws IllegalArgumentException if {@code bars} is empty
     * @throws IllegalStateException if there is nothing to advance
     */
    public TickResult fastForward(String symbol, List<Candle> bars) {
        requireSymbol(symbol);
        if (bars == null || bars.isEmpty()) {
            throw new IllegalArgumentException("fastForward needs at least one bar");
        }
        if (scheduledSignal == null && pendingSignal == null) {
            if (stopped) {
                return emit(new IdleResult(key, bars.get(bars.size() - 1).closeTime(), IdleReason.STOPPED));
            }
            throw new IllegalStateException("Nothing to fast-forward for " + key);
        }

        EngineConfig cfg = config.get();
        int window = cfg.avgPriceCandlesCount();
        int first = Math.min(window, bars.size()) - 1;

        TickResult last = null;
        for (int i = first; i < bars.size(); i++) {
            Instant when = bars.get(i).closeTime();
            double price = VwapCalculator.trailing(bars, i, window);

            last = advance(price, when, cfg);

            if (last.isTerminal() || last instanceof IdleResult) {
                return emit(last);
            }
            if (last instanceof OpenedResult) {
                emit(last);
            }
        }
        log.debug("{} fast-forward exhausted {} bars without terminal outcome", key, bars.size());
        return last;
    }

    // ═══════════════════════════════════════════════════════════════
    // ONE STEP
    // ═══════════════════════════════════════════════════════════════

    /**
     * Single transition for an existing scheduled or open signal at reference price {@code price}.
     */
    private TickResult advance(double price, Instant when, EngineConfig cfg) {
        if (scheduledSignal != null) {
            return advanceScheduled(scheduledSignal, price, when, cfg);
        }
        return advanceOpen(pendingSignal, price, when, cfg);
    }

    private TickResult advanceScheduled(Signal s, double price, Instant when, EngineConfig cfg) {
        // 1. Waited too long
        Duration waited = Duration.between(s.scheduledAt(), when);
        if (waited.compareTo(Duration.ofMinutes(cfg.scheduleAwaitMinutes())) >= 0) {
            return cancelScheduled(s, price, when, CancelReason.TIMEOUT);
        }

        // 2. Stop-loss crossed before the entry was reached
        boolean breached = s.isLong() ? price <= s.priceStopLoss() : price >= s.priceStopLoss();
        if (breached) {
            return cancelScheduled(s, price, when, CancelReason.STOP_LOSS_BREACHED);
        }

        // 3. Entry reached
        if (entryReached(s.direction(), price, s.priceOpen())) {
            return activate(s, price, when);
        }

        return new ScheduledResult(key, when, s, price, false);
    }

    private TickResult advanceOpen(Signal s, double price, Instant when, EngineConfig cfg) {
        // Priority: lifetime, take-profit, stop-loss
        if (!when.isBefore(s.expiresAt())) {
            return close(s, price, when, CloseReason.TIME_EXPIRED, cfg);
        }

        boolean tpHit = s.isLong() ? price >= s.priceTakeProfit() : price <= s.priceTakeProfit();
        if (tpHit) {
            return close(s, s.priceTakeProfit(), when, CloseReason.TAKE_PROFIT, cfg);
        }

        boolean slHit = s.isLong() ? price <= s.priceStopLoss() : price >= s.priceStopLoss();
        if (slHit) {
            return close(s, s.priceStopLoss(), when, CloseReason.STOP_LOSS, cfg);
        }

        return new ActiveResult(key, when, s, price,
            PnlCalculator.percentTp(s, price), PnlCalculator.percentSl(s, price));
    }

    // ═══════════════════════════════════════════════════════════════
    // TRANSITIONS
    // ═══════════════════════════════════════════════════════════════

    private TickResult generate(String symbol, Instant when, EngineConfig cfg) {
        if (lastGenerationAt != null && when.isBefore(lastGenerationAt.plus(interval.toDuration()))) {
            return new IdleResult(key, when, IdleReason.THROTTLED);
        }
        lastGenerationAt = when;

        Optional<SignalProposal> maybe;
        try {
            maybe = callGenerator(symbol, when, cfg);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} signal generator failed: {}", key, cause.getMessage());
            metrics.recordFault(key.strategyName(), false);
            sink.publishFault(new FaultEvent(key, when, cause, false));
            return new IdleResult(key, when, IdleReason.NO_SIGNAL);
        }
        if (maybe == null || maybe.isEmpty()) {
            return new IdleResult(key, when, IdleReason.NO_SIGNAL);
        }
        SignalProposal proposal = maybe.get();

        double price = oracle.getReferencePrice(symbol, when, cfg.avgPriceCandlesCount());
        boolean scheduled = proposal.hasEntryPrice()
            && proposal.direction() != null
            && !entryReached(proposal.direction(), price, proposal.priceOpen());

        ValidationResult validation = SignalValidator.validate(proposal, price, scheduled, cfg);
        if (!validation.passed()) {
            log.warn("{} proposal rejected: {} {}", key, validation.code(), validation.message());
            metrics.recordRejection(key.strategyName(), validation.code().name());
            sink.publishRejection(new RejectionEvent(key, when, proposal,
                validation.code().name(), validation.message(), backtest));
            return new IdleResult(key, when, IdleReason.REJECTED);
        }

        Signal signal = toSignal(proposal, price, when, scheduled);
        if (!signal.isWellFormed()) {
            throw new InvariantViolationException(key.toString(), "Validated proposal produced malformed signal " + signal);
        }

        AdmissionDecision decision = gate.check(proposal, new AdmissionContext(key, price, when, backtest));
        if (!decision.allowed()) {
            rejectAdmission(proposal, when, decision);
            return new IdleResult(key, when, IdleReason.ADMISSION_REJECTED);
        }
        metrics.adjustLivePositions(key.strategyName(), 1);

        if (scheduled) {
            scheduledSignal = signal;
            persistSchedule(signal);
            log.info("[SIGNAL SCHEDULED] {} {} {} entry={} tp={} sl={}", key, signal.id(), signal.direction(),
                signal.priceOpen(), signal.priceTakeProfit(), signal.priceStopLoss());
            return new ScheduledResult(key, when, signal, price, false);
        }

        pendingSignal = signal;
        gate.register(signal);
        persistSignal(signal);
        log.info("[SIGNAL OPENED] {} {} {} entry={} tp={} sl={}", key, signal.id(), signal.direction(),
            signal.priceOpen(), signal.priceTakeProfit(), signal.priceStopLoss());
        return new OpenedResult(key, when, signal, price, false);
    }

    private TickResult activate(Signal s, double price, Instant when) {
        SignalProposal asProposal = new SignalProposal(s.id(), s.direction(), s.priceOpen(),
            s.priceTakeProfit(), s.priceStopLoss(), s.minuteEstimatedTime(), s.note());
        AdmissionDecision decision = gate.check(asProposal, new AdmissionContext(key, price, when, backtest));
        if (!decision.allowed()) {
            scheduledSignal = null;
            gate.unregister(s);
            persistSchedule(null);
            metrics.adjustLivePositions(key.strategyName(), -1);
            rejectAdmission(asProposal, when, decision);
            return new IdleResult(key, when, IdleReason.ADMISSION_REJECTED);
        }

        Signal opened = s.activate(when);
        scheduledSignal = null;
        pendingSignal = opened;
        gate.register(opened);
        // Open slot first: a crash in between leaves both slots set, and restore prefers the open one
        persistSignal(opened);
        persistSchedule(null);
        log.info("[SIGNAL OPENED] {} {} activated at {} (scheduled {})", key, opened.id(), price, s.scheduledAt());
        return new OpenedResult(key, when, opened, price, false);
    }

    private TickResult close(Signal s, double closePrice, Instant when, CloseReason reason, EngineConfig cfg) {
        ProfitLoss pnl = PnlCalculator.calculate(s, closePrice, cfg);
        pendingSignal = null;
        gate.unregister(s);
        persistSignal(null);
        metrics.adjustLivePositions(key.strategyName(), -1);
        metrics.recordClose(key.strategyName(), reason, pnl.pnlPercent());
        log.info("[SIGNAL CLOSED] {} {} {} at {} pnl={}%", key, s.id(), reason, closePrice,
            String.format("%.4f", pnl.pnlPercent()));
        return new ClosedResult(key, when, s, closePrice, reason, pnl);
    }

    private CancelledResult cancelScheduled(Signal s, double price, Instant when, CancelReason reason) {
        scheduledSignal = null;
        gate.unregister(s);
        persistSchedule(null);
        metrics.adjustLivePositions(key.strategyName(), -1);
        log.info("[SIGNAL CANCELLED] {} {} {}", key, s.id(), reason);
        return new CancelledResult(key, when, s, price, reason);
    }

    private void rejectAdmission(SignalProposal proposal, Instant when, AdmissionDecision decision) {
        log.warn("{} admission rejected: {}", key, decision.reason());
        metrics.recordRejection(key.strategyName(), RejectionEvent.ADMISSION);
        sink.publishRejection(new RejectionEvent(key, when, proposal, RejectionEvent.ADMISSION,
            decision.reason(), backtest));
    }

    // ═══════════════════════════════════════════════════════════════
    // COMMANDS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Stop generating new signals. A scheduled order is discarded; an open position keeps
     * being monitored until it closes by its own rules.
     */
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        log.info("[STOP] {} stopping (open position: {})", key, pendingSignal != null);
        Signal scheduled = scheduledSignal;
        if (scheduled != null) {
            emit(cancelScheduled(scheduled, Double.NaN, clock.instant(), CancelReason.USER));
        }
    }

    public boolean isStopped() {
        return stopped;
    }

    /**
     * Discard the scheduled order, if any.
     */
    public Optional<CancelledResult> cancelScheduled(Instant when) {
        Signal scheduled = scheduledSignal;
        if (scheduled == null) {
            return Optional.empty();
        }
        CancelledResult result = cancelScheduled(scheduled, Double.NaN, when, CancelReason.USER);
        emit(result);
        return Optional.of(result);
    }

    /**
     * Move the stop-loss of the open position towards its entry.
     *
     * @param percentShift share of the entry-to-original-stop distance to move, 0 &lt; shift &lt; 100
     * @param currentPrice price used to refuse a stop that would trigger at once
     * @return true if the stop was moved
     */
    public boolean trailingStop(double percentShift, double currentPrice) {
        Signal s = pendingSignal;
        if (s == null) {
            log.debug("{} trailing stop ignored: no open position", key);
            return false;
        }
        if (!(percentShift > 0 && percentShift < 100)) {
            log.warn("{} trailing stop rejected: shift {} outside (0, 100)", key, percentShift);
            return false;
        }

        double distance = Math.abs(s.priceOpen() - s.originalPriceStopLoss());
        double shift = distance * percentShift / 100.0;
        double newStop = s.isLong() ? s.originalPriceStopLoss() + shift : s.originalPriceStopLoss() - shift;

        boolean tightens = s.isLong() ? newStop > s.priceStopLoss() : newStop < s.priceStopLoss();
        if (!tightens) {
            log.debug("{} trailing stop ignored: {} does not tighten {}", key, newStop, s.priceStopLoss());
            return false;
        }
        boolean crossed = s.isLong() ? currentPrice <= newStop : currentPrice >= newStop;
        if (crossed) {
            log.warn("{} trailing stop rejected: price {} already past new stop {}", key, currentPrice, newStop);
            return false;
        }

        Signal moved = s.withStopLoss(newStop);
        if (!moved.isWellFormed()) {
            throw new InvariantViolationException(key.toString(), "Trailing stop produced malformed signal " + moved);
        }
        pendingSignal = moved;
        persistSignal(moved);
        log.info("[TRAILING STOP] {} {} stop {} -> {}", key, s.id(), s.priceStopLoss(), newStop);
        return true;
    }

    // ═══════════════════════════════════════════════════════════════
    // RESTORE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Load durable state and announce it to observers as restored. No-op in backtest mode.
     *
     * @return the result published for the restored signal, if there was one
     */
    public Optional<TickResult> restore() {
        if (backtest || persistence == null) {
            return Optional.empty();
        }
        SignalPersistence.Restored restored = persistence.restore(key);
        Instant now = clock.instant();

        if (restored.signal() != null) {
            pendingSignal = restored.signal();
            scheduledSignal = null;
            if (restored.scheduled() != null) {
                log.warn("[RESTORE] {} has both an open and a scheduled signal, dropping scheduled {}",
                    key, restored.scheduled().id());
                persistSchedule(null);
            }
            gate.register(pendingSignal);
            metrics.adjustLivePositions(key.strategyName(), 1);
            return Optional.of(emit(new OpenedResult(key, now, pendingSignal, Double.NaN, true)));
        }
        if (restored.scheduled() != null) {
            scheduledSignal = restored.scheduled();
            metrics.adjustLivePositions(key.strategyName(), 1);
            return Optional.of(emit(new ScheduledResult(key, now, scheduledSignal, Double.NaN, true)));
        }
        return Optional.empty();
    }

    // ═══════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════

    private Optional<SignalProposal> callGenerator(String symbol, Instant when, EngineConfig cfg)
            throws ExecutionException {
        Duration timeout = Duration.ofSeconds(cfg.maxSignalGenerationSeconds());
        long start = System.nanoTime();
        Future<Optional<SignalProposal>> future = executor().submit(() -> generator.generate(symbol, when));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordFault(key.strategyName(), true);
            log.error("{} signal generator exceeded {}s", key, timeout.toSeconds());
            throw new SignalGenerationTimeoutException(key.toString(), timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for signal generator of " + key, e);
        } finally {
            metrics.recordGeneration(key.strategyName(), Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private synchronized ExecutorService executor() {
        if (generatorExecutor == null) {
            generatorExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "signal-gen-" + key);
                t.setDaemon(true);
                return t;
            });
        }
        return generatorExecutor;
    }

    private Signal toSignal(SignalProposal p, double price, Instant when, boolean scheduled) {
        double entry = p.hasEntryPrice() ? p.priceOpen() : price;
        String id = p.id() != null ? p.id() : UUID.randomUUID().toString();
        return new Signal(id, key.symbol(), key.strategyName(), key.exchangeName(), p.direction(),
            entry, p.priceTakeProfit(), p.priceStopLoss(), p.priceTakeProfit(), p.priceStopLoss(),
            p.minuteEstimatedTime(), when, when, scheduled, p.note());
    }

    private static boolean entryReached(Direction direction, double price, double entry) {
        return direction == Direction.LONG ? price <= entry : price >= entry;
    }

    private TickResult emit(TickResult result) {
        metrics.recordTick(key.strategyName(), result.action());
        sink.publish(result, backtest);
        return result;
    }

    private void persistSignal(Signal signal) {
        if (persistence != null) {
            persistence.writeSignal(key, signal);
        }
    }

    private void persistSchedule(Signal signal) {
        if (persistence != null) {
            persistence.writeSchedule(key, signal);
        }
    }

    private void requireSymbol(String symbol) {
        if (!key.symbol().equals(symbol)) {
            throw new IllegalArgumentException("State machine for " + key + " cannot evaluate " + symbol);
        }
    }

    public SignalKey key() {
        return key;
    }

    public boolean isBacktest() {
        return backtest;
    }

    public Optional<Signal> pendingSignal() {
        return Optional.ofNullable(pendingSignal);
    }

    public Optional<Signal> scheduledSignal() {
        return Optional.ofNullable(scheduledSignal);
    }

    /**
     * True while an open position or a scheduled order exists.
     */
    public boolean hasPosition() {
        return pendingSignal != null || scheduledSignal != null;
    }

    @Override
    public synchronized void close() {
        if (generatorExecutor != null) {
            generatorExecutor.shutdownNow();
        }
    }

    public static Builder builder(SignalKey key) {
        return new Builder(key);
    }

    /**
     * Builder for SignalStateMachine.
     */
    public static final class Builder {
        private final SignalKey key;
        private PriceOracle oracle;
        private SignalGenerator generator;
        private AdmissionGate gate = AdmissionGate.allowAll();
        private EventSink sink = EventSink.noop();
        private SignalPersistence persistence;
        private Supplier<EngineConfig> config = ConfigRegistry.supplier();
        private EngineMetrics metrics = EngineMetrics.noop();
        private SignalInterval interval = SignalInterval.MINUTE_1;
        private Clock clock = Clock.systemUTC();
        private ExecutorService generatorExecutor;
        private boolean backtest = false;

        private Builder(SignalKey key) {
            this.key = key;
        }

        public Builder oracle(PriceOracle oracle) { this.oracle = oracle; return this; }
        public Builder generator(SignalGenerator generator) { this.generator = generator; return this; }
        public Builder gate(AdmissionGate gate) { this.gate = gate; return this; }
        public Builder sink(EventSink sink) { this.sink = sink; return this; }
        public Builder persistence(SignalPersistence persistence) { this.persistence = persistence; return this; }
        public Builder metrics(EngineMetrics metrics) { this.metrics = metrics; return this; }
        public Builder interval(SignalInterval interval) { this.interval = interval; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder generatorExecutor(ExecutorService executor) { this.generatorExecutor = executor; return this; }
        public Builder backtest(boolean backtest) { this.backtest = backtest; return this; }

        /**
         * Fixed configuration for this instance, instead of the process-wide default.
         */
        public Builder config(EngineConfig config) {
            Objects.requireNonNull(config, "config");
            this.config = () -> config;
            return this;
        }

        public Builder config(Supplier<EngineConfig> config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public SignalStateMachine build() {
            if (!backtest && persistence == null) {
                log.warn("{} runs live without persistence; state will not survive a restart", key);
            }
            return new SignalStateMachine(this);
        }
    }
}
