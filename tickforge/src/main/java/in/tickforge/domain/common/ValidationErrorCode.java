package in.tickforge.domain.common;

/**
 * Reasons a trade proposal is refused by the signal validator.
 */
public enum ValidationErrorCode {
    MISSING_FIELD,
    NON_FINITE_PRICE,
    NON_POSITIVE_PRICE,
    INVALID_PRICE_ORDER,
    PRICE_PAST_STOP_LOSS,
    PRICE_PAST_TAKE_PROFIT,
    ENTRY_OUTSIDE_RANGE,
    TAKE_PROFIT_TOO_CLOSE,
    STOP_LOSS_TOO_CLOSE,
    STOP_LOSS_TOO_FAR,
    INVALID_LIFETIME,
    LIFETIME_TOO_LONG
}
