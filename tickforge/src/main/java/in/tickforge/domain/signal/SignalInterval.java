package in.tickforge.domain.signal;

import java.time.Duration;

/**
 * Minimum spacing between two signal generation attempts for one key.
 */
public enum SignalInterval {
    MINUTE_1(1),
    MINUTE_3(3),
    MINUTE_5(5),
    MINUTE_15(15),
    MINUTE_30(30),
    HOUR_1(60);

    private final int minutes;

    SignalInterval(int minutes) {
        this.minutes = minutes;
    }

    public Duration toDuration() {
        return Duration.ofMinutes(minutes);
    }
}
