package dev.pekelund.shelfscan.scanner.catalog;

/**
 * Active product of the reference catalog.
 */
public record CatalogProduct(String id, String name, double price, String description, String brand,
    String category) {
}
