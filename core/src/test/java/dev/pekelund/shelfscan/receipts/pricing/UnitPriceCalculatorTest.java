package dev.pekelund.shelfscan.receipts.pricing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class UnitPriceCalculatorTest {

    @Test
    void dividesAmountByQuantity() {
        assertThat(UnitPriceCalculator.calculateUnitPrice(100.0, 5.0))
            .isEqualTo(new PriceCalculationResult(true, 20.0, null));
    }

    @Test
    void zeroAmountIsAValidPrice() {
        assertThat(UnitPriceCalculator.calculateUnitPrice(0.0, 5.0))
            .isEqualTo(new PriceCalculationResult(true, 0.0, null));
    }

    @Test
    void doesNotRound() {
        assertThat(UnitPriceCalculator.calculateUnitPrice(10.0, 3.0).unitPrice()).isEqualTo(10.0 / 3.0);
    }

    @Test
    void reportsZeroQuantity() {
        assertThat(UnitPriceCalculator.calculateUnitPrice(100.0, 0.0))
            .isEqualTo(new PriceCalculationResult(false, null, PriceCalculationError.ZERO_QUANTITY));
    }

    @Test
    void reportsMissingValuesBeforeAnythingElse() {
        assertThat(UnitPriceCalculator.calculateUnitPrice(null, 5.0).error())
            .isEqualTo(PriceCalculationError.MISSING_NET_AMOUNT);
        assertThat(UnitPriceCalculator.calculateUnitPrice(null, null).error())
            .isEqualTo(PriceCalculationError.MISSING_NET_AMOUNT);
        assertThat(UnitPriceCalculator.calculateUnitPrice(100.0, null).error())
            .isEqualTo(PriceCalculationError.MISSING_QUANTITY);
    }

    @Test
    void rejectsNegativeAndNaNValues() {
        assertThat(UnitPriceCalculator.calculateUnitPrice(-1.0, 5.0).error())
            .isEqualTo(PriceCalculationError.INVALID_VALUES);
        assertThat(UnitPriceCalculator.calculateUnitPrice(10.0, -2.0).error())
            .isEqualTo(PriceCalculationError.INVALID_VALUES);
        assertThat(UnitPriceCalculator.calculateUnitPrice(Double.NaN, 0.0).error())
            .isEqualTo(PriceCalculationError.INVALID_VALUES);
        assertThat(UnitPriceCalculator.calculateUnitPrice(-5.0, 0.0).error())
            .isEqualTo(PriceCalculationError.INVALID_VALUES);
    }
}
