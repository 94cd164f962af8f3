package dev.pekelund.shelfscan.receipts.extraction;

import dev.pekelund.shelfscan.receipts.mapping.ColumnMapping;
import dev.pekelund.shelfscan.receipts.model.ExtractedReceiptProduct;
import dev.pekelund.shelfscan.receipts.model.ParsedReceipt;
import dev.pekelund.shelfscan.receipts.model.ParsedRow;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the products of every row of a receipt and removes duplicates by case-insensitive name,
 * keeping the first occurrence.
 */
public class ReceiptProductExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptProductExtractor.class);

    private final RowExtractor rowExtractor;

    public ReceiptProductExtractor(RowExtractor rowExtractor) {
        this.rowExtractor = rowExtractor;
    }

    public List<ExtractedReceiptProduct> extractProducts(ParsedReceipt receipt, ColumnMapping mapping) {
        if (receipt == null || mapping == null) {
            return List.of();
        }

        List<ExtractedReceiptProduct> products = new ArrayList<>();
        Set<String> seenNames = new HashSet<>();
        int skipped = 0;
        int duplicates = 0;

        for (ParsedRow row : receipt.rows()) {
            Optional<ExtractedReceiptProduct> product = rowExtractor.extract(row, mapping);
            if (product.isEmpty()) {
                skipped++;
                continue;
            }
            if (!seenNames.add(product.get().name().toLowerCase(Locale.ROOT))) {
                duplicates++;
                continue;
            }
            products.add(product.get());
        }

        LOGGER.info("Extracted {} products from {} rows ({} skipped, {} duplicates)", products.size(),
            receipt.rows().size(), skipped, duplicates);
        return products;
    }
}
