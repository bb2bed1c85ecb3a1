package in.tickforge.exception;

/**
 * Thrown when price data cannot be obtained or is malformed after all retries.
 */
public class PriceOracleException extends RecoverableEngineException {

    private final String symbol;

    public PriceOracleException(String symbol, String message) {
        super(symbol, message);
        this.symbol = symbol;
    }

    public PriceOracleException(String symbol, String message, Throwable cause) {
        super(symbol, message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
