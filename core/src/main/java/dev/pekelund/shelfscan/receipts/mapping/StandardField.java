package dev.pekelund.shelfscan.receipts.mapping;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Standard receipt fields a column header can be mapped to, each with the header spellings that
 * identify it. Spellings are compared lower-cased and trimmed.
 */
public enum StandardField {
    PRODUCT_NAME("productName", List.of("item description", "description", "item", "product", "particulars",
        "goods", "product name", "item name", "material", "article")),
    QUANTITY("quantity", List.of("qty", "pcs", "units", "cs", "quantity", "nos", "no", "count", "pieces", "unit")),
    NET_AMOUNT("netAmount", List.of("net amt", "net amount", "amount", "amt", "total", "value", "net", "net value",
        "taxable value", "taxable amt")),
    MRP("mrp", List.of("mrp", "rate", "price", "unit price", "unit rate", "u.price", "u.rate")),
    GROSS_AMOUNT("grossAmount", List.of("gross amt", "gross amount", "gross", "gross value")),
    UNKNOWN("unknown", List.of());

    private final String fieldName;
    private final List<String> headerVariations;

    StandardField(String fieldName, List<String> headerVariations) {
        this.fieldName = fieldName;
        this.headerVariations = headerVariations;
    }

    @JsonValue
    public String fieldName() {
        return fieldName;
    }

    public List<String> headerVariations() {
        return headerVariations;
    }
}
