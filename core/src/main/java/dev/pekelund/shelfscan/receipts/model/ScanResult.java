package dev.pekelund.shelfscan.receipts.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Outcome of scanning one receipt image. A failed scan carries a human readable {@code error} and
 * no products.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanResult(
    boolean success,
    List<ExtractedReceiptProduct> products,
    ReceiptMetadata metadata,
    double confidence,
    List<MappingDecision> mappingLog,
    String error
) {

    public ScanResult {
        products = products != null ? List.copyOf(products) : List.of();
        metadata = metadata != null ? metadata : ReceiptMetadata.unknown();
        mappingLog = mappingLog != null ? List.copyOf(mappingLog) : List.of();
    }

    public static ScanResult success(List<ExtractedReceiptProduct> products, ReceiptMetadata metadata,
        double confidence, List<MappingDecision> mappingLog) {
        return new ScanResult(true, products, metadata, confidence, mappingLog, null);
    }

    public static ScanResult failure(String error, ReceiptMetadata metadata, List<MappingDecision> mappingLog) {
        return new ScanResult(false, List.of(), metadata, 0.0, mappingLog, error);
    }

    public ScanResult withProducts(List<ExtractedReceiptProduct> newProducts) {
        return new ScanResult(success, newProducts, metadata, confidence, mappingLog, error);
    }
}
