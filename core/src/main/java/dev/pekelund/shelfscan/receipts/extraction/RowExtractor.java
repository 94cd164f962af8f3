package dev.pekelund.shelfscan.receipts.extraction;

import dev.pekelund.shelfscan.receipts.ReceiptScanDefaults;
import dev.pekelund.shelfscan.receipts.extraction.ProductCodeSeparator.SeparatedName;
import dev.pekelund.shelfscan.receipts.mapping.ColumnMapping;
import dev.pekelund.shelfscan.receipts.model.CellData;
import dev.pekelund.shelfscan.receipts.model.ExtractedReceiptProduct;
import dev.pekelund.shelfscan.receipts.model.FieldConfidences;
import dev.pekelund.shelfscan.receipts.model.ParsedRow;
import dev.pekelund.shelfscan.receipts.pricing.PriceCalculationResult;
import dev.pekelund.shelfscan.receipts.pricing.UnitPriceCalculator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Builds a product from one mapped table row.
 *
 * <p>A row without a product name, or whose name is nothing but a product code, yields no product.
 * Missing quantities default to 1 and missing amounts to 0. The overall confidence is the mean of the
 * name, quantity and amount cell confidences, where an absent quantity or amount cell counts with a
 * configurable default.</p>
 */
public class RowExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RowExtractor.class);

    private static final double DEFAULT_QUANTITY = 1.0;
    private static final double DEFAULT_NET_AMOUNT = 0.0;

    private final double missingFieldConfidence;
    private final double reviewThreshold;
    private final ProductIdGenerator idGenerator;

    public RowExtractor() {
        this(ReceiptScanDefaults.MISSING_FIELD_CONFIDENCE, ReceiptScanDefaults.CONFIDENCE_THRESHOLD,
            new ProductIdGenerator());
    }

    public RowExtractor(double missingFieldConfidence, double reviewThreshold, ProductIdGenerator idGenerator) {
        this.missingFieldConfidence = missingFieldConfidence;
        this.reviewThreshold = reviewThreshold;
        this.idGenerator = idGenerator;
    }

    public Optional<ExtractedReceiptProduct> extract(ParsedRow row, ColumnMapping mapping) {
        if (row == null || mapping == null) {
            return Optional.empty();
        }

        Optional<CellData> nameCell = row.cellAt(mapping.productName());
        if (nameCell.isEmpty() || !StringUtils.hasText(nameCell.get().text())) {
            LOGGER.debug("Skipping row without product name: '{}'", row.rawText());
            return Optional.empty();
        }

        String originalName = nameCell.get().text();
        SeparatedName separated = ProductCodeSeparator.separate(originalName);
        if (!StringUtils.hasText(separated.name())) {
            LOGGER.debug("Skipping row whose name is only a code: '{}'", originalName);
            return Optional.empty();
        }

        Optional<CellData> quantityCell = row.cellAt(mapping.quantity());
        Optional<CellData> amountCell = row.cellAt(mapping.netAmount());

        double quantity = quantityCell
            .map(cell -> ReceiptNumbers.parseOrDefault(cell.text(), DEFAULT_QUANTITY))
            .orElse(DEFAULT_QUANTITY);
        double netAmount = amountCell
            .map(cell -> ReceiptNumbers.parseOrDefault(cell.text(), DEFAULT_NET_AMOUNT))
            .orElse(DEFAULT_NET_AMOUNT);
        PriceCalculationResult price = UnitPriceCalculator.calculateUnitPrice(netAmount, quantity);

        Double mrp = null;
        if (mapping.mrp() != null) {
            mrp = row.cellAt(mapping.mrp())
                .filter(cell -> StringUtils.hasText(cell.text()))
                .map(cell -> ReceiptNumbers.parseOrDefault(cell.text(), 0.0))
                .filter(value -> value > 0)
                .orElse(null);
        }

        FieldConfidences fieldConfidences = new FieldConfidences(
            nameCell.get().confidence(),
            quantityCell.map(CellData::confidence).orElse(missingFieldConfidence),
            amountCell.map(CellData::confidence).orElse(missingFieldConfidence));
        double confidence = fieldConfidences.average();
        boolean needsReview = confidence < reviewThreshold || !price.success();

        if (!price.success()) {
            LOGGER.debug("Unit price not computed for '{}': {}", separated.name(), price.error());
        }

        return Optional.of(new ExtractedReceiptProduct(
            idGenerator.nextId(),
            separated.name(),
            originalName,
            row.rawText(),
            quantity,
            netAmount,
            price.unitPrice(),
            mrp,
            separated.code(),
            confidence,
            needsReview,
            fieldConfidences,
            nameCell.get().boundingBox(),
            null,
            null));
    }
}
