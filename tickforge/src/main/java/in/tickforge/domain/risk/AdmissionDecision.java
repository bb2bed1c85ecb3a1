package in.tickforge.domain.risk;

/**
 * Portfolio-level verdict on a proposal or an activating scheduled order.
 */
public record AdmissionDecision(boolean allowed, String reason) {
    private static final AdmissionDecision ALLOW = new AdmissionDecision(true, null);

    public static AdmissionDecision allow() {
        return ALLOW;
    }

    public static AdmissionDecision reject(String reason) {
        return new AdmissionDecision(false, reason);
    }
}
