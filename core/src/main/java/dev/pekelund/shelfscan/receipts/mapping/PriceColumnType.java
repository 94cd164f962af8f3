package dev.pekelund.shelfscan.receipts.mapping;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic origin of the column chosen as the authoritative price column.
 */
public enum PriceColumnType {
    NET("net"),
    MRP("mrp"),
    GROSS("gross");

    private final String value;

    PriceColumnType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
