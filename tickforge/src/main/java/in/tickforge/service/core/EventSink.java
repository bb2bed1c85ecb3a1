package in.tickforge.service.core;

import in.tickforge.domain.event.FaultEvent;
import in.tickforge.domain.event.RejectionEvent;
import in.tickforge.domain.tick.TickResult;

/**
 * Receives every committed transition, rejection and fault of the engine.
 *
 * Transitions published for one key must reach each subscriber in publish order.
 */
public interface EventSink {

    void publish(TickResult result, boolean backtest);

    void publishRejection(RejectionEvent event);

    void publishFault(FaultEvent event);

    static EventSink noop() {
        return new EventSink() {
            @Override
            public void publish(TickResult result, boolean backtest) {
            }

            @Override
            public void publishRejection(RejectionEvent event) {
            }

            @Override
            public void publishFault(FaultEvent event) {
            }
        };
    }
}
