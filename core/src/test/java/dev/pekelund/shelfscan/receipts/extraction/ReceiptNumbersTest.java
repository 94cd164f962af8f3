package dev.pekelund.shelfscan.receipts.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ReceiptNumbersTest {

    @Test
    void readsNumbersSurroundedByNoise() {
        assertThat(ReceiptNumbers.parseOrDefault("Rs 1,250.50", 0)).isEqualTo(1250.50);
        assertThat(ReceiptNumbers.parseOrDefault("5 pcs", 1)).isEqualTo(5.0);
        assertThat(ReceiptNumbers.parseOrDefault("₹ 99", 0)).isEqualTo(99.0);
    }

    @Test
    void fallsBackToDefaultForUnparsableOrZeroValues() {
        assertThat(ReceiptNumbers.parseOrDefault("", 1)).isEqualTo(1.0);
        assertThat(ReceiptNumbers.parseOrDefault("n/a", 1)).isEqualTo(1.0);
        assertThat(ReceiptNumbers.parseOrDefault("0", 1)).isEqualTo(1.0);
        assertThat(ReceiptNumbers.parseOrDefault(null, 1)).isEqualTo(1.0);
    }

    @Test
    void ignoresSignAndTrailingDots() {
        assertThat(ReceiptNumbers.parseOrDefault("-3", 1)).isEqualTo(3.0);
        assertThat(ReceiptNumbers.parseOrDefault("1.2.3", 0)).isEqualTo(1.2);
    }
}
