package dev.pekelund.shelfscan.receipts.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single table cell detected by OCR.
 *
 * @param text cell text, possibly empty
 * @param columnIndex zero-based column index aligned with the receipt headers
 * @param rowIndex zero-based data row index, the header row is not counted
 * @param confidence OCR confidence in the range [0, 1]
 * @param boundingBox optional cell position
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CellData(String text, int columnIndex, int rowIndex, double confidence, BoundingBox boundingBox) {

    public CellData {
        text = text != null ? text : "";
    }

    public CellData(String text, int columnIndex, int rowIndex, double confidence) {
        this(text, columnIndex, rowIndex, confidence, null);
    }
}
