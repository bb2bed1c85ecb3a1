package in.tickforge.service.core;

import in.tickforge.domain.event.FaultEvent;
import in.tickforge.domain.event.RejectionEvent;
import in.tickforge.domain.event.SignalEvent;
import in.tickforge.domain.tick.TickResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Signal Event Bus.
 * Three channels: transitions, rejections, faults.
 *
 * Delivery rule: per subscriber, event n+1 starts only after the stage returned for event n
 * has completed. Subscribers are not ordered relative to each other. A handler that throws
 * or completes exceptionally is reported on the fault channel and the chain carries on.
 */
public final class SignalEventBus implements EventSink, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SignalEventBus.class);

    private final List<Subscription<SignalEvent>> signalSubscribers = new CopyOnWriteArrayList<>();
    private final List<Subscription<RejectionEvent>> rejectionSubscribers = new CopyOnWriteArrayList<>();
    private final List<Subscription<FaultEvent>> faultSubscribers = new CopyOnWriteArrayList<>();

    private final AtomicLong seq = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Clock clock;

    public SignalEventBus() {
        this(newDeliveryExecutor(), true, Clock.systemUTC());
    }

    public SignalEventBus(ExecutorService executor, Clock clock) {
        this(executor, false, clock);
    }

    private SignalEventBus(ExecutorService executor, boolean ownsExecutor, Clock clock) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // SUBSCRIBE
    // ═══════════════════════════════════════════════════════════════

    public Subscription<SignalEvent> subscribeSignals(String name, EventSubscriber<SignalEvent> subscriber) {
        return add(signalSubscribers, name, subscriber);
    }

    public Subscription<RejectionEvent> subscribeRejections(String name, EventSubscriber<RejectionEvent> subscriber) {
        return add(rejectionSubscribers, name, subscriber);
    }

    public Subscription<FaultEvent> subscribeFaults(String name, EventSubscriber<FaultEvent> subscriber) {
        return add(faultSubscribers, name, subscriber);
    }

    private <E> Subscription<E> add(List<Subscription<E>> list, String name, EventSubscriber<E> subscriber) {
        Subscription<E> subscription = new Subscription<>(name, subscriber, list);
        list.add(subscription);
        log.debug("Subscriber added: {}", name);
        return subscription;
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISH
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void publish(TickResult result, boolean backtest) {
        if (rejectIfClosed("signal")) {
            return;
        }
        SignalEvent event = new SignalEvent(seq.incrementAndGet(), backtest, clock.instant(), result);
        for (Subscription<SignalEvent> s : signalSubscribers) {
            s.enqueue(event, true);
        }
    }

    @Override
    public void publishRejection(RejectionEvent event) {
        if (rejectIfClosed("rejection")) {
            return;
        }
        for (Subscription<RejectionEvent> s : rejectionSubscribers) {
            s.enqueue(event, true);
        }
    }

    @Override
    public void publishFault(FaultEvent event) {
        if (event.fatal()) {
            log.error("[FAULT] {} fatal: {}", event.key(), event.error().getMessage(), event.error());
        } else {
            log.warn("[FAULT] {}: {}", event.key(), event.error().getMessage());
        }
        if (rejectIfClosed("fault")) {
            return;
        }
        for (Subscription<FaultEvent> s : faultSubscribers) {
            s.enqueue(event, false);
        }
    }

    /**
     * Sequence number of the last published transition.
     */
    public long lastSeq() {
        return seq.get();
    }

    // ═══════════════════════════════════════════════════════════════
    // DRAIN
    // ═══════════════════════════════════════════════════════════════

    /**
     * Wait until every subscriber has finished every event published so far.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        List<CompletableFuture<Void>> tails = new ArrayList<>();
        for (Subscription<?> s : signalSubscribers) tails.add(s.tail());
        for (Subscription<?> s : rejectionSubscribers) tails.add(s.tail());
        for (Subscription<?> s : faultSubscribers) tails.add(s.tail());
        try {
            CompletableFuture.allOf(tails.toArray(new CompletableFuture[0]))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // Tails never complete exceptionally; failures are turned into fault events.
            throw new IllegalStateException("Event delivery chain failed", e.getCause());
        }
    }

    /**
     * Stop accepting events, drain what is queued and release the delivery threads.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!awaitIdle(Duration.ofSeconds(10))) {
                log.warn("Event bus closed with undelivered events");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining event bus");
        }
        if (ownsExecutor) {
            executor.shutdown();
        }
        log.info("Event bus closed after {} signal events", seq.get());
    }

    private boolean rejectIfClosed(String channel) {
        if (closed.get()) {
            log.warn("Event bus closed, dropping {} event", channel);
            return true;
        }
        return false;
    }

    private void reportHandlerFailure(String subscriber, Object event, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause() : error;
        log.warn("Subscriber {} failed on {}: {}", subscriber, event.getClass().getSimpleName(), cause.getMessage());
        publishFault(new FaultEvent(null, clock.instant(), cause, false));
    }

    private static ExecutorService newDeliveryExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "event-bus-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * One subscriber's FIFO delivery chain.
     */
    public final class Subscription<E> {
        private final String name;
        private final EventSubscriber<E> subscriber;
        private final List<Subscription<E>> owner;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        private Subscription(String name, EventSubscriber<E> subscriber, List<Subscription<E>> owner) {
            this.name = name;
            this.subscriber = subscriber;
            this.owner = owner;
        }

        private synchronized void enqueue(E event, boolean reportFailures) {
            tail = tail
                .thenComposeAsync(ignored -> deliver(event), executor)
                .exceptionally(error -> {
                    if (reportFailures) {
                        reportHandlerFailure(name, event, error);
                    } else {
                        log.error("Fault subscriber {} failed: {}", name, error.getMessage());
                    }
                    return null;
                });
        }

        private CompletableFuture<Void> deliver(E event) {
            try {
                return subscriber.onEvent(event).toCompletableFuture();
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        private synchronized CompletableFuture<Void> tail() {
            return tail;
        }

        public String name() {
            return name;
        }

        public void cancel() {
            owner.remove(this);
        }
    }
}
