package in.tickforge.domain.market;

import java.time.Duration;

/**
 * Bar intervals understood by the price oracle.
 */
public enum CandleInterval {
    MINUTE_1("1m", 1),
    MINUTE_3("3m", 3),
    MINUTE_5("5m", 5),
    MINUTE_15("15m", 15),
    MINUTE_30("30m", 30),
    HOUR_1("1h", 60),
    HOUR_2("2h", 120),
    HOUR_4("4h", 240),
    HOUR_6("6h", 360),
    HOUR_8("8h", 480);

    private final String code;
    private final int minutes;

    CandleInterval(String code, int minutes) {
        this.code = code;
        this.minutes = minutes;
    }

    public String getCode() {
        return code;
    }

    public int getMinutes() {
        return minutes;
    }

    public Duration toDuration() {
        return Duration.ofMinutes(minutes);
    }

    public static CandleInterval fromCode(String code) {
        for (CandleInterval interval : values()) {
            if (interval.code.equals(code)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unknown candle interval: " + code);
    }
}
