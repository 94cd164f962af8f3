package dev.pekelund.shelfscan.scanner.ocr;

import java.util.List;

/**
 * Table detected by OCR. {@code confidence} is a percentage and may be {@code null}.
 */
public record OcrTable(List<OcrCell> cells, Double confidence) {

    public OcrTable {
        cells = cells != null ? List.copyOf(cells) : List.of();
    }
}
