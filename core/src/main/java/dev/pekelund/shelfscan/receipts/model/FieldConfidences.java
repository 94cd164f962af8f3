package dev.pekelund.shelfscan.receipts.model;

/**
 * Per-field confidence of an extracted product.
 */
public record FieldConfidences(double name, double quantity, double netAmount) {

    public double average() {
        return (name + quantity + netAmount) / 3.0;
    }
}
