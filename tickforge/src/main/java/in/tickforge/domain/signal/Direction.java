package in.tickforge.domain.signal;

/**
 * Position direction.
 */
public enum Direction {
    LONG,   // Profit when price rises: SL < entry < TP
    SHORT   // Profit when price falls: TP < entry < SL
}
