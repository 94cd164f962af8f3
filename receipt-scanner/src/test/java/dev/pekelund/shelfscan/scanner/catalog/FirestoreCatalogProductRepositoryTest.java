package dev.pekelund.shelfscan.scanner.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FirestoreCatalogProductRepositoryTest {

    @Test
    void mapsCatalogDocumentFields() {
        CatalogProduct product = FirestoreCatalogProductRepository.toCatalogProduct("p-1", Map.of(
            "name", "Maggi Noodles",
            "price", 12L,
            "brand", "Nestle",
            "category", "Food",
            "description", "Instant noodles"));

        assertThat(product).isEqualTo(
            new CatalogProduct("p-1", "Maggi Noodles", 12.0, "Instant noodles", "Nestle", "Food"));
    }

    @Test
    void acceptsNumericTextPricesAndDefaultsOtherwise() {
        assertThat(FirestoreCatalogProductRepository.toCatalogProduct("a", Map.of("name", "Tea", "price", " 45.5 "))
            .price()).isEqualTo(45.5);
        assertThat(FirestoreCatalogProductRepository.toCatalogProduct("b", Map.of("name", "Tea", "price", "n/a"))
            .price()).isZero();
        assertThat(FirestoreCatalogProductRepository.toCatalogProduct("c", Map.of("name", "Tea")).price()).isZero();
    }

    @Test
    void skipsDocumentsWithoutAName() {
        Map<String, Object> data = new HashMap<>();
        data.put("name", " ");
        data.put("price", 10);

        assertThat(FirestoreCatalogProductRepository.toCatalogProduct("x", data)).isNull();
        assertThat(FirestoreCatalogProductRepository.toCatalogProduct("y", null)).isNull();
    }
}
