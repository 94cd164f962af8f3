package dev.pekelund.shelfscan.scanner.catalog;

import java.util.List;

/**
 * Catalog used when no catalog store is configured.
 */
public class EmptyCatalogProductRepository implements CatalogProductRepository {

    @Override
    public List<CatalogProduct> listActiveProducts() {
        return List.of();
    }
}
