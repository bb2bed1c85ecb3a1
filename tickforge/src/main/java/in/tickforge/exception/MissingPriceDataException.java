package in.tickforge.exception;

/**
 * Thrown when the oracle has no bars at all for a reference price. Nothing can be
 * evaluated for the key, so this is never retried.
 */
public class MissingPriceDataException extends FatalEngineException {

    private final String symbol;

    public MissingPriceDataException(String symbol, String message) {
        super(symbol, message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
