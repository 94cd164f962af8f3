package dev.pekelund.shelfscan.scanner.catalog;

import dev.pekelund.shelfscan.receipts.model.CatalogMatch;
import dev.pekelund.shelfscan.receipts.model.ExtractedReceiptProduct;
import dev.pekelund.shelfscan.receipts.model.ScanResult;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches the most similar catalog product to every scanned product. A match at or above the
 * threshold replaces the unit price and brand with the catalog values; weaker matches are attached
 * for reference only.
 */
public class CatalogEnricher {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogEnricher.class);

    private final CatalogProductRepository repository;
    private final double matchThreshold;

    public CatalogEnricher(CatalogProductRepository repository, double matchThreshold) {
        this.repository = repository;
        this.matchThreshold = matchThreshold;
    }

    public ScanResult enrich(ScanResult result) {
        if (result == null || result.products().isEmpty()) {
            return result;
        }
        List<CatalogProduct> catalog;
        try {
            catalog = repository.listActiveProducts();
        } catch (CatalogUnavailableException ex) {
            LOGGER.warn("Catalog unavailable; returning products without enrichment: {}", ex.getMessage());
            return result;
        }
        if (catalog.isEmpty()) {
            LOGGER.info("Catalog is empty; nothing to match against");
            return result;
        }

        List<ExtractedReceiptProduct> enriched = new ArrayList<>(result.products().size());
        int applied = 0;
        for (ExtractedReceiptProduct product : result.products()) {
            CatalogMatch match = bestMatch(product.name(), catalog);
            if (match != null && match.applied()) {
                applied++;
            }
            enriched.add(product.withCatalogMatch(match));
        }
        LOGGER.info("Catalog matching applied {} of {} products", applied, enriched.size());
        return result.withProducts(enriched);
    }

    CatalogMatch bestMatch(String name, List<CatalogProduct> catalog) {
        CatalogProduct best = null;
        double bestSimilarity = 0.0;
        for (CatalogProduct candidate : catalog) {
            double similarity = NameSimilarity.of(name, candidate.name());
            if (similarity > bestSimilarity) {
                best = candidate;
                bestSimilarity = similarity;
            }
        }
        if (best == null) {
            return null;
        }
        LOGGER.debug("Best catalog match for '{}' is '{}' ({})", name, best.name(), bestSimilarity);
        return new CatalogMatch(best.id(), best.name(), best.price(), best.brand(), bestSimilarity,
            bestSimilarity >= matchThreshold);
    }
}
