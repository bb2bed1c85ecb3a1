package in.tickforge.service.risk;

import in.tickforge.domain.risk.AdmissionContext;
import in.tickforge.domain.risk.AdmissionDecision;
import in.tickforge.domain.signal.Signal;
import in.tickforge.domain.signal.SignalProposal;

/**
 * Portfolio-level admission of new or activating trades.
 *
 * Implementations shared by several keys must serialize their decisions so two keys cannot
 * both pass a limit at the same time.
 */
public interface AdmissionGate {

    AdmissionDecision check(SignalProposal proposal, AdmissionContext context);

    /**
     * Called when a position opens (or is restored).
     */
    void register(Signal signal);

    /**
     * Called when a position closes or a scheduled order is discarded.
     */
    void unregister(Signal signal);

    static AdmissionGate allowAll() {
        return new AdmissionGate() {
            @Override
            public AdmissionDecision check(SignalProposal proposal, AdmissionContext context) {
                return AdmissionDecision.allow();
            }

            @Override
            public void register(Signal signal) {
            }

            @Override
            public void unregister(Signal signal) {
            }
        };
    }
}
