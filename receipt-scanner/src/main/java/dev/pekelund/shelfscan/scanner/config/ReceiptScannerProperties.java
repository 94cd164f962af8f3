package dev.pekelund.shelfscan.scanner.config;

import dev.pekelund.shelfscan.receipts.ReceiptScanDefaults;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "receipt.scanner")
public class ReceiptScannerProperties {

    /**
     * Products with a confidence below this value are flagged for review.
     */
    private double confidenceThreshold = ReceiptScanDefaults.CONFIDENCE_THRESHOLD;

    /**
     * Whether documents without a usable table are sent to the name-only AI fallback.
     */
    private boolean enableAiFallback = true;

    /**
     * Maximum number of products returned for one scan.
     */
    private int maxProducts = ReceiptScanDefaults.MAX_PRODUCTS;

    /**
     * Confidence ceiling applied when the receipt layout could not be classified.
     */
    private double unknownFormatMaxConfidence = ReceiptScanDefaults.UNKNOWN_FORMAT_MAX_CONFIDENCE;

    /**
     * Confidence assumed for a missing quantity or amount cell.
     */
    private double missingFieldConfidence = ReceiptScanDefaults.MISSING_FIELD_CONFIDENCE;

    /**
     * Confidence of products whose names were corrected by the generative model.
     */
    private double aiFallbackConfidence = ReceiptScanDefaults.AI_FALLBACK_CONFIDENCE;

    /**
     * Confidence of products taken verbatim from OCR lines.
     */
    private double rawLineFallbackConfidence = ReceiptScanDefaults.RAW_LINE_FALLBACK_CONFIDENCE;

    /**
     * Largest accepted upload in bytes.
     */
    private long maxImageBytes = ScannerSettings.DEFAULT_MAX_IMAGE_BYTES;

    /**
     * Minimum name similarity for a catalog product to replace the extracted price and brand.
     */
    private double catalogMatchThreshold = ReceiptScanDefaults.CATALOG_MATCH_THRESHOLD;

    public ScannerSettings toSettings() {
        requireFraction("confidence-threshold", confidenceThreshold);
        requireFraction("unknown-format-max-confidence", unknownFormatMaxConfidence);
        requireFraction("missing-field-confidence", missingFieldConfidence);
        requireFraction("ai-fallback-confidence", aiFallbackConfidence);
        requireFraction("raw-line-fallback-confidence", rawLineFallbackConfidence);
        requireFraction("catalog-match-threshold", catalogMatchThreshold);
        if (maxProducts <= 0) {
            throw new IllegalStateException("receipt.scanner.max-products must be positive but was " + maxProducts);
        }
        if (maxImageBytes <= 0) {
            throw new IllegalStateException(
                "receipt.scanner.max-image-bytes must be positive but was " + maxImageBytes);
        }
        return new ScannerSettings(confidenceThreshold, enableAiFallback, maxProducts, unknownFormatMaxConfidence,
            missingFieldConfidence, aiFallbackConfidence, rawLineFallbackConfidence, maxImageBytes,
            catalogMatchThreshold);
    }

    private static void requireFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalStateException(String.format(
                "receipt.scanner.%s must be between 0 and 1 but was %s", name, value));
        }
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public boolean isEnableAiFallback() {
        return enableAiFallback;
    }

    public void setEnableAiFallback(boolean enableAiFallback) {
        this.enableAiFallback = enableAiFallback;
    }

    public int getMaxProducts() {
        return maxProducts;
    }

    public void setMaxProducts(int maxProducts) {
        this.maxProducts = maxProducts;
    }

    public double getUnknownFormatMaxConfidence() {
        return unknownFormatMaxConfidence;
    }

    public void setUnknownFormatMaxConfidence(double unknownFormatMaxConfidence) {
        this.unknownFormatMaxConfidence = unknownFormatMaxConfidence;
    }

    public double getMissingFieldConfidence() {
        return missingFieldConfidence;
    }

    public void setMissingFieldConfidence(double missingFieldConfidence) {
        this.missingFieldConfidence = missingFieldConfidence;
    }

    public double getAiFallbackConfidence() {
        return aiFallbackConfidence;
    }

    public void setAiFallbackConfidence(double aiFallbackConfidence) {
        this.aiFallbackConfidence = aiFallbackConfidence;
    }

    public double getRawLineFallbackConfidence() {
        return rawLineFallbackConfidence;
    }

    public void setRawLineFallbackConfidence(double rawLineFallbackConfidence) {
        this.rawLineFallbackConfidence = rawLineFallbackConfidence;
    }

    public long getMaxImageBytes() {
        return maxImageBytes;
    }

    public void setMaxImageBytes(long maxImageBytes) {
        this.maxImageBytes = maxImageBytes;
    }

    public double getCatalogMatchThreshold() {
        return catalogMatchThreshold;
    }

    public void setCatalogMatchThreshold(double catalogMatchThreshold) {
        this.catalogMatchThreshold = catalogMatchThreshold;
    }
}
