package in.tickforge.service.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Downstream observer of one event channel.
 *
 * The returned stage must complete when handling is finished; the next event is not
 * delivered to this subscriber before that.
 */
@FunctionalInterface
public interface EventSubscriber<E> {

    CompletionStage<Void> onEvent(E event);

    /**
     * Adapt a blocking handler.
     */
    static <E> EventSubscriber<E> sync(Consumer<E> handler) {
        return event -> {
            handler.accept(event);
            return CompletableFuture.completedFuture(null);
        };
    }
}
