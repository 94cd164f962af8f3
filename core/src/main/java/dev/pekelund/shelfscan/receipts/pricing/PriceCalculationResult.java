package dev.pekelund.shelfscan.receipts.pricing;

/**
 * Result of a unit price calculation. On failure {@code unitPrice} is {@code null} and {@code error}
 * names the reason.
 */
public record PriceCalculationResult(boolean success, Double unitPrice, PriceCalculationError error) {

    static PriceCalculationResult of(double unitPrice) {
        return new PriceCalculationResult(true, unitPrice, null);
    }

    static PriceCalculationResult failure(PriceCalculationError error) {
        return new PriceCalculationResult(false, null, error);
    }
}
