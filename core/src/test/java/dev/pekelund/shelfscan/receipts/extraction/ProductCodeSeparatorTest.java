package dev.pekelund.shelfscan.receipts.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.shelfscan.receipts.extraction.ProductCodeSeparator.SeparatedName;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ProductCodeSeparatorTest {

    static Stream<Arguments> hsnCodes() {
        return Stream.of(
            Arguments.of("1234", "Maggi Noodles"),
            Arguments.of("84713010", "Dettol Soap"),
            Arguments.of("30049099", "Horlicks Classic Malt"),
            Arguments.of("190230", "Tea"));
    }

    @ParameterizedTest
    @MethodSource("hsnCodes")
    void separatesLeadingHsnCode(String code, String name) {
        SeparatedName separated = ProductCodeSeparator.separate(code + " " + name);

        assertThat(separated.name()).isEqualTo(name);
        assertThat(separated.code()).isEqualTo(code);
    }

    @ParameterizedTest
    @MethodSource("hsnCodes")
    void separatesTrailingHsnCode(String code, String name) {
        SeparatedName separated = ProductCodeSeparator.separate(name + " " + code);

        assertThat(separated.name()).isEqualTo(name).doesNotContain(code);
        assertThat(separated.code()).isEqualTo(code);
    }

    @Test
    void separatesLongNumericCode() {
        SeparatedName separated = ProductCodeSeparator.separate("Parle G Biscuit 890123456789");

        assertThat(separated.name()).isEqualTo("Parle G Biscuit");
        assertThat(separated.code()).isEqualTo("890123456789");
    }

    @Test
    void separatesSkuStyleCode() {
        SeparatedName separated = ProductCodeSeparator.separate("AB123-X Lux Soap");

        assertThat(separated.name()).isEqualTo("Lux Soap");
        assertThat(separated.code()).isEqualTo("AB123-X");
    }

    @Test
    void leavesNamesWithoutCodesUntouched() {
        SeparatedName separated = ProductCodeSeparator.separate("  Amul Butter ");

        assertThat(separated.name()).isEqualTo("Amul Butter");
        assertThat(separated.hasCode()).isFalse();
    }

    @Test
    void codeInTheMiddleIsNotSeparated() {
        SeparatedName separated = ProductCodeSeparator.separate("Maggi 1234 Noodles");

        assertThat(separated.name()).isEqualTo("Maggi 1234 Noodles");
        assertThat(separated.code()).isNull();
    }
}
