package in.tickforge.domain.signal;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Identity of one state machine: a trading symbol traded by one strategy on one exchange.
 */
public record SignalKey(String symbol, String strategyName, String exchangeName) {

    public SignalKey {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(strategyName, "strategyName");
        Objects.requireNonNull(exchangeName, "exchangeName");
    }

    /**
     * Key used by the persistence backends, unique per key.
     * Each part keeps [A-Za-z0-9-] and percent-encodes every other UTF-8 byte,
     * so the "_" separator never occurs inside a part.
     */
    public String storageKey() {
        return encode(strategyName) + "_" + encode(exchangeName) + "_" + encode(symbol);
    }

    private static String encode(String part) {
        StringBuilder sb = new StringBuilder(part.length());
        for (byte b : part.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-') {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    @Override
    public String toString() {
        return strategyName + ":" + exchangeName + ":" + symbol;
    }
}
