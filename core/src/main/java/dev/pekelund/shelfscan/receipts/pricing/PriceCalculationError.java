package dev.pekelund.shelfscan.receipts.pricing;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reasons a unit price could not be computed.
 */
public enum PriceCalculationError {
    MISSING_NET_AMOUNT("missing_net_amount"),
    MISSING_QUANTITY("missing_quantity"),
    ZERO_QUANTITY("zero_quantity"),
    INVALID_VALUES("invalid_values");

    private final String code;

    PriceCalculationError(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
