package dev.pekelund.shelfscan.receipts.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * Coarse document layout inferred from the table header vocabulary.
 */
public enum ReceiptFormatType {
    TAX_INVOICE("tax_invoice"),
    DISTRIBUTOR_BILL("distributor_bill"),
    SIMPLE_LIST("simple_list"),
    UNKNOWN("unknown");

    private final String value;

    ReceiptFormatType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<ReceiptFormatType> fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.value.equals(value))
            .findFirst();
    }

    @JsonCreator
    static ReceiptFormatType fromJson(String value) {
        return fromValue(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown receipt format type: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
