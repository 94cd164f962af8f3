package dev.pekelund.shelfscan.receipts.mapping;

import dev.pekelund.shelfscan.receipts.model.MappingDecision;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps receipt column headers onto {@link StandardField standard fields} by exact, case-insensitive
 * comparison with the known header spellings, and picks the column used for unit prices.
 *
 * <p>The price column is chosen in the order net amount, MRP, gross amount. Mapping succeeds only when
 * a product name column, a quantity column and at least one price column were found. When a header
 * spelling appears in several columns the first one wins.</p>
 */
public class ColumnMapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(ColumnMapper.class);

    public MapColumnsResult mapColumns(List<String> headers) {
        if (headers == null || headers.isEmpty()) {
            LOGGER.info("No headers to map");
            return MapColumnsResult.failed(List.of());
        }

        Map<StandardField, Integer> firstColumn = new EnumMap<>(StandardField.class);
        List<MappingDecision> decisions = new ArrayList<>(headers.size());

        for (int index = 0; index < headers.size(); index++) {
            String header = headers.get(index) != null ? headers.get(index) : "";
            StandardField field = classify(header);
            if (field == StandardField.UNKNOWN) {
                decisions.add(new MappingDecision(header, field.fieldName(), 0.0,
                    "No matching variation found for \"" + header + "\""));
                continue;
            }
            firstColumn.putIfAbsent(field, index);
            decisions.add(new MappingDecision(header, field.fieldName(), 1.0,
                "Matched \"" + header + "\" to " + field.fieldName() + " field"));
        }

        Integer productName = firstColumn.get(StandardField.PRODUCT_NAME);
        Integer quantity = firstColumn.get(StandardField.QUANTITY);
        Integer net = firstColumn.get(StandardField.NET_AMOUNT);
        Integer mrp = firstColumn.get(StandardField.MRP);
        Integer gross = firstColumn.get(StandardField.GROSS_AMOUNT);

        PriceColumnType priceType;
        Integer priceColumn;
        if (net != null) {
            priceType = PriceColumnType.NET;
            priceColumn = net;
        } else if (mrp != null) {
            priceType = PriceColumnType.MRP;
            priceColumn = mrp;
        } else if (gross != null) {
            priceType = PriceColumnType.GROSS;
            priceColumn = gross;
        } else {
            priceType = null;
            priceColumn = null;
        }

        if (productName == null || quantity == null || priceColumn == null) {
            LOGGER.info("Column mapping failed (productName: {}, quantity: {}, price column: {})", productName,
                quantity, priceColumn);
            return MapColumnsResult.failed(decisions);
        }

        ColumnMapping mapping = new ColumnMapping(productName, quantity, priceColumn,
            mrp != null && !mrp.equals(priceColumn) ? mrp : null,
            gross != null && !gross.equals(priceColumn) ? gross : null);
        LOGGER.info("Mapped {} headers; price column {} ({})", headers.size(), priceColumn, priceType.value());
        return new MapColumnsResult(mapping, decisions, true, priceColumn, priceType);
    }

    /**
     * Returns the field whose header spellings contain the given header, or {@link StandardField#UNKNOWN}.
     */
    public static StandardField classify(String header) {
        if (header == null) {
            return StandardField.UNKNOWN;
        }
        String normalised = header.trim().toLowerCase(Locale.ROOT);
        for (StandardField field : StandardField.values()) {
            if (field.headerVariations().contains(normalised)) {
                return field;
            }
        }
        return StandardField.UNKNOWN;
    }
}
