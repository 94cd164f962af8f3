package dev.pekelund.shelfscan.receipts.model;

/**
 * Catalog entry that was found to resemble an extracted product name.
 *
 * @param similarity normalized name similarity in the range [0, 1]
 * @param applied whether the catalog values replaced the extracted ones
 */
public record CatalogMatch(String id, String name, double price, String brand, double similarity, boolean applied) {
}
