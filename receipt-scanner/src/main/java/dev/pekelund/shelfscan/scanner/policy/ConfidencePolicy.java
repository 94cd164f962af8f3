package dev.pekelund.shelfscan.scanner.policy;

import dev.pekelund.shelfscan.receipts.model.ExtractedReceiptProduct;
import dev.pekelund.shelfscan.receipts.model.ReceiptFormatType;
import dev.pekelund.shelfscan.receipts.pricing.PriceCalculationResult;
import dev.pekelund.shelfscan.receipts.pricing.UnitPriceCalculator;
import dev.pekelund.shelfscan.scanner.config.ScannerSettings;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Final pass applied to the products of every scan, structured or not.
 *
 * <p>Confidences are clamped into [0, 1] with NaN treated as 0, capped for layouts of unknown format,
 * and the review flag is recomputed from the final value. The list is then cut to the configured
 * maximum, keeping the original order.</p>
 */
public class ConfidencePolicy {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfidencePolicy.class);

    private final ScannerSettings settings;

    public ConfidencePolicy(ScannerSettings settings) {
        this.settings = settings;
    }

    public List<ExtractedReceiptProduct> apply(List<ExtractedReceiptProduct> products, ReceiptFormatType formatType,
        boolean alwaysReview) {
        if (products == null || products.isEmpty()) {
            return List.of();
        }
        boolean unknownFormat = formatType == null || formatType == ReceiptFormatType.UNKNOWN;
        int limit = Math.min(products.size(), settings.maxProducts());
        if (limit < products.size()) {
            LOGGER.info("Truncating {} products to the configured maximum of {}", products.size(), limit);
        }

        List<ExtractedReceiptProduct> processed = new ArrayList<>(limit);
        for (ExtractedReceiptProduct product : products.subList(0, limit)) {
            ExtractedReceiptProduct current = backfillUnitPrice(product);
            current = backfillOriginalText(current);

            double confidence = clamp(current.confidence());
            if (unknownFormat) {
                confidence = Math.min(confidence, settings.unknownFormatMaxConfidence());
            }
            boolean needsReview = alwaysReview || confidence < settings.confidenceThreshold();
            processed.add(current.withConfidence(confidence, needsReview));
        }
        return processed;
    }

    /**
     * Arithmetic mean of the product confidences, or 0 for an empty list.
     */
    public static double aggregateConfidence(List<ExtractedReceiptProduct> products) {
        if (products == null || products.isEmpty()) {
            return 0.0;
        }
        return products.stream()
            .mapToDouble(ExtractedReceiptProduct::confidence)
            .average()
            .orElse(0.0);
    }

    static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static ExtractedReceiptProduct backfillUnitPrice(ExtractedReceiptProduct product) {
        if (product.unitPrice() != null || !(product.netAmount() > 0) || !(product.quantity() > 0)) {
            return product;
        }
        PriceCalculationResult result = UnitPriceCalculator.calculateUnitPrice(product.netAmount(),
            product.quantity());
        return result.success() ? product.withUnitPrice(result.unitPrice()) : product;
    }

    private static ExtractedReceiptProduct backfillOriginalText(ExtractedReceiptProduct product) {
        if (StringUtils.hasText(product.originalText())) {
            return product;
        }
        String text = StringUtils.hasText(product.originalName()) ? product.originalName() : product.name();
        return product.withOriginalText(text);
    }
}
