package dev.pekelund.shelfscan.receipts.mapping;

import dev.pekelund.shelfscan.receipts.model.MappingDecision;
import java.util.List;

/**
 * Outcome of mapping a header row. {@code mapping}, {@code priceColumnIndex} and {@code priceColumnType}
 * are {@code null} when the mapping failed.
 */
public record MapColumnsResult(
    ColumnMapping mapping,
    List<MappingDecision> decisions,
    boolean success,
    Integer priceColumnIndex,
    PriceColumnType priceColumnType
) {

    public MapColumnsResult {
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
    }

    public static MapColumnsResult failed(List<MappingDecision> decisions) {
        return new MapColumnsResult(null, decisions, false, null, null);
    }
}
