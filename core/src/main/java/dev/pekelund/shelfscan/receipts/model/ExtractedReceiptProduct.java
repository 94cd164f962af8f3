package dev.pekelund.shelfscan.receipts.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Product line extracted from a receipt.
 *
 * <p>{@code originalName} and {@code originalText} always hold the OCR text the product was built
 * from, whatever cleaning was applied to {@code name}. {@code unitPrice} is {@code null} when no unit
 * price could be computed.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedReceiptProduct(
    String id,
    String name,
    String originalName,
    String originalText,
    double quantity,
    double netAmount,
    Double unitPrice,
    Double mrp,
    String hsnCode,
    double confidence,
    boolean needsReview,
    FieldConfidences fieldConfidences,
    BoundingBox boundingBox,
    String brand,
    CatalogMatch catalogMatch
) {

    public ExtractedReceiptProduct withUnitPrice(Double newUnitPrice) {
        return new ExtractedReceiptProduct(id, name, originalName, originalText, quantity, netAmount, newUnitPrice,
            mrp, hsnCode, confidence, needsReview, fieldConfidences, boundingBox, brand, catalogMatch);
    }

    public ExtractedReceiptProduct withOriginalText(String newOriginalText) {
        return new ExtractedReceiptProduct(id, name, originalName, newOriginalText, quantity, netAmount, unitPrice,
            mrp, hsnCode, confidence, needsReview, fieldConfidences, boundingBox, brand, catalogMatch);
    }

    public ExtractedReceiptProduct withConfidence(double newConfidence, boolean newNeedsReview) {
        return new ExtractedReceiptProduct(id, name, originalName, originalText, quantity, netAmount, unitPrice,
            mrp, hsnCode, newConfidence, newNeedsReview, fieldConfidences, boundingBox, brand, catalogMatch);
    }

    public ExtractedReceiptProduct withCatalogMatch(CatalogMatch match) {
        if (match == null) {
            return this;
        }
        if (!match.applied()) {
            return new ExtractedReceiptProduct(id, name, originalName, originalText, quantity, netAmount, unitPrice,
                mrp, hsnCode, confidence, needsReview, fieldConfidences, boundingBox, brand, match);
        }
        String resolvedBrand = match.brand() != null ? match.brand() : brand;
        return new ExtractedReceiptProduct(id, name, originalName, originalText, quantity,
            match.price() * quantity, match.price(), mrp, hsnCode, confidence, needsReview, fieldConfidences,
            boundingBox, resolvedBrand, match);
    }
}
