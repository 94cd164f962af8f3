package dev.pekelund.shelfscan.scanner.ocr;

import dev.pekelund.shelfscan.receipts.model.BoundingBox;

/**
 * Table cell as reported by OCR, with 1-based row and column indexes and a confidence percentage.
 */
public record OcrCell(String text, int rowIndex, int columnIndex, Double confidence, BoundingBox geometry) {
}
