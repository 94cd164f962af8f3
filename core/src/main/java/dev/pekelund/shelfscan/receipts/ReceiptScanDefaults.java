package dev.pekelund.shelfscan.receipts;

/**
 * Default policy values shared by the extraction pipeline and the scanner service. The scanner
 * exposes each of them as a configuration property.
 */
public final class ReceiptScanDefaults {

    /**
     * Products with an overall confidence below this value are flagged for review.
     */
    public static final double CONFIDENCE_THRESHOLD = 0.7;

    /**
     * Confidence ceiling for products read from a layout that could not be classified.
     */
    public static final double UNKNOWN_FORMAT_MAX_CONFIDENCE = 0.5;

    /**
     * Confidence assumed for a quantity or amount cell that is missing from a row.
     */
    public static final double MISSING_FIELD_CONFIDENCE = 0.5;

    /**
     * Overall confidence of a product whose name was cleaned up by the generative model.
     */
    public static final double AI_FALLBACK_CONFIDENCE = 0.35;

    /**
     * Overall confidence of a product taken verbatim from an OCR line.
     */
    public static final double RAW_LINE_FALLBACK_CONFIDENCE = 0.3;

    /**
     * Minimum name similarity for a catalog entry to override extracted values.
     */
    public static final double CATALOG_MATCH_THRESHOLD = 0.8;

    public static final int MAX_PRODUCTS = 100;

    public static final String DEFAULT_CATALOG_COLLECTION = "master_products";

    private ReceiptScanDefaults() {
    }
}
