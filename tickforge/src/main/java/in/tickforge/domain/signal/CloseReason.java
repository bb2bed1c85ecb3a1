package in.tickforge.domain.signal;

/**
 * Why an open position was closed. Evaluated in declaration order.
 */
public enum CloseReason {
    TIME_EXPIRED, // Estimated lifetime elapsed, exit at the reference price
    TAKE_PROFIT,  // Reference price crossed TP, exit at the TP price
    STOP_LOSS     // Reference price crossed SL, exit at the SL price
}
