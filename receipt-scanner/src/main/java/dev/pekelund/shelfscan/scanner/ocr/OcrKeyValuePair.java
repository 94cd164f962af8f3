package dev.pekelund.shelfscan.scanner.ocr;

/**
 * Form field detected by OCR, for example {@code Invoice No} / {@code INV-2291}.
 */
public record OcrKeyValuePair(String key, String value, Double confidence) {
}
