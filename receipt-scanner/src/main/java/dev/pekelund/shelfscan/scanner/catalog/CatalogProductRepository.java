package dev.pekelund.shelfscan.scanner.catalog;

import java.util.List;

/**
 * Read access to the reference product catalog.
 */
public interface CatalogProductRepository {

    /**
     * Returns every product that is currently active.
     *
     * @throws CatalogUnavailableException when the catalog cannot be read
     */
    List<CatalogProduct> listActiveProducts();
}
