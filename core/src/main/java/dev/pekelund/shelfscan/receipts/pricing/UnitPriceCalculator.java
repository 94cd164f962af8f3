package dev.pekelund.shelfscan.receipts.pricing;

/**
 * Divides a line amount by its quantity. Checks run in a fixed order so the reported error is
 * deterministic, and the result is not rounded.
 */
public final class UnitPriceCalculator {

    private UnitPriceCalculator() {
    }

    public static PriceCalculationResult calculateUnitPrice(Double netAmount, Double quantity) {
        if (netAmount == null) {
            return PriceCalculationResult.failure(PriceCalculationError.MISSING_NET_AMOUNT);
        }
        if (quantity == null) {
            return PriceCalculationResult.failure(PriceCalculationError.MISSING_QUANTITY);
        }
        if (netAmount.isNaN() || quantity.isNaN()) {
            return PriceCalculationResult.failure(PriceCalculationError.INVALID_VALUES);
        }
        if (netAmount < 0 || quantity < 0) {
            return PriceCalculationResult.failure(PriceCalculationError.INVALID_VALUES);
        }
        if (quantity == 0) {
            return PriceCalculationResult.failure(PriceCalculationError.ZERO_QUANTITY);
        }
        return PriceCalculationResult.of(netAmount / quantity);
    }
}
