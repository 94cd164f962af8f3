package dev.pekelund.shelfscan.scanner;

/**
 * Stages a scan moves through. {@link #AI_FALLBACK} can be entered from any stage before
 * {@link #POSTPROCESS}.
 */
public enum ScanStage {
    OCR("ocr"),
    STRUCTURE_PARSE("structure_parse"),
    COLUMN_MAP("column_map"),
    ROW_EXTRACT("row_extract"),
    AI_FALLBACK("ai_fallback"),
    POSTPROCESS("postprocess"),
    DONE("done");

    private final String value;

    ScanStage(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
