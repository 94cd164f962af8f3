package dev.pekelund.shelfscan.scanner.config;

import dev.pekelund.shelfscan.receipts.ReceiptScanDefaults;

/**
 * Validated scanner policy values resolved from {@link ReceiptScannerProperties}.
 */
public record ScannerSettings(
    double confidenceThreshold,
    boolean enableAiFallback,
    int maxProducts,
    double unknownFormatMaxConfidence,
    double missingFieldConfidence,
    double aiFallbackConfidence,
    double rawLineFallbackConfidence,
    long maxImageBytes,
    double catalogMatchThreshold
) {

    public static final long DEFAULT_MAX_IMAGE_BYTES = 10L * 1024 * 1024;

    public static ScannerSettings defaults() {
        return new ScannerSettings(
            ReceiptScanDefaults.CONFIDENCE_THRESHOLD,
            true,
            ReceiptScanDefaults.MAX_PRODUCTS,
            ReceiptScanDefaults.UNKNOWN_FORMAT_MAX_CONFIDENCE,
            ReceiptScanDefaults.MISSING_FIELD_CONFIDENCE,
            ReceiptScanDefaults.AI_FALLBACK_CONFIDENCE,
            ReceiptScanDefaults.RAW_LINE_FALLBACK_CONFIDENCE,
            DEFAULT_MAX_IMAGE_BYTES,
            ReceiptScanDefaults.CATALOG_MATCH_THRESHOLD);
    }

    public ScannerSettings withAiFallback(boolean enabled) {
        return new ScannerSettings(confidenceThreshold, enabled, maxProducts, unknownFormatMaxConfidence,
            missingFieldConfidence, aiFallbackConfidence, rawLineFallbackConfidence, maxImageBytes,
            catalogMatchThreshold);
    }

    public ScannerSettings withMaxProducts(int limit) {
        return new ScannerSettings(confidenceThreshold, enableAiFallback, limit, unknownFormatMaxConfidence,
            missingFieldConfidence, aiFallbackConfidence, rawLineFallbackConfidence, maxImageBytes,
            catalogMatchThreshold);
    }
}
