package dev.pekelund.shelfscan.scanner.ocr;

import java.util.List;

/**
 * Provider-neutral OCR output: the page text lines in reading order, any detected tables and form
 * key/value pairs.
 */
public record OcrAnalysis(List<String> textLines, List<OcrTable> tables, List<OcrKeyValuePair> keyValuePairs) {

    public OcrAnalysis {
        textLines = textLines != null ? List.copyOf(textLines) : List.of();
        tables = tables != null ? List.copyOf(tables) : List.of();
        keyValuePairs = keyValuePairs != null ? List.copyOf(keyValuePairs) : List.of();
    }

    public boolean isEmpty() {
        return textLines.isEmpty() && tables.isEmpty();
    }
}
