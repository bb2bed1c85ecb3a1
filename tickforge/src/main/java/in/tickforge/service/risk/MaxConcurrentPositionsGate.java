package in.tickforge.service.risk;

import in.tickforge.domain.risk.AdmissionContext;
import in.tickforge.domain.risk.AdmissionDecision;
import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalKey;
import in.tickforge.domain.signal.SignalProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Admission gate capping the number of simultaneously open positions in one portfolio.
 *
 * A successful check reserves the slot for the checking key until it registers or unregisters
 * a position, so two keys cannot both pass the last free slot. A scheduled order that is
 * discarded before activation is unregistered, which frees its reservation. Positions are counted per key.
 */
public final class MaxConcurrentPositionsGate implements AdmissionGate {
    private static final Logger log = LoggerFactory.getLogger(MaxConcurrentPositionsGate.class);

    private final int limit;
    private final Map<SignalKey, String> open = new HashMap<>();       // key → signal id
    private final Map<SignalKey, Boolean> reserved = new HashMap<>();

    public MaxConcurrentPositionsGate(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Position limit must be positive: " + limit);
        }
        this.limit = limit;
    }

    @Override
    public synchronized AdmissionDecision check(SignalProposal proposal, AdmissionContext context) {
        SignalKey key = context.key();
        if (open.containsKey(key) || reserved.containsKey(key)) {
            return AdmissionDecision.allow();
        }
        int used = open.size() + reserved.size();
        if (used >= limit) {
            log.debug("Admission refused for {}: {} of {} slots used", key, used, limit);
            return AdmissionDecision.reject("Max concurrent positions reached (" + limit + ")");
        }
        reserved.put(key, Boolean.TRUE);
        return AdmissionDecision.allow();
    }

    @Override
    public synchronized void register(Signal signal) {
        reserved.remove(signal.key());
        open.put(signal.key(), signal.id());
    }

    @Override
    public synchronized void unregister(Signal signal) {
        reserved.remove(signal.key());
        open.remove(signal.key());
    }

    public synchronized int openPositions() {
        return open.size();
    }
}
