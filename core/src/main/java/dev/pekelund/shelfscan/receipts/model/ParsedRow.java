package dev.pekelund.shelfscan.receipts.model;

import java.util.List;
import java.util.Optional;

/**
 * One data row of a parsed receipt table. {@code rawText} keeps the row text exactly as it was
 * assembled from the OCR output.
 */
public record ParsedRow(List<CellData> cells, String rawText) {

    public static final String CELL_DELIMITER = " | ";

    public ParsedRow {
        cells = cells != null ? List.copyOf(cells) : List.of();
        rawText = rawText != null ? rawText : "";
    }

    /**
     * Finds the cell that belongs to the given column. Rows may hold fewer cells than there are
     * headers, in which case the column is absent.
     */
    public Optional<CellData> cellAt(int columnIndex) {
        return cells.stream()
            .filter(cell -> cell.columnIndex() == columnIndex)
            .findFirst();
    }
}
