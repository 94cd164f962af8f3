package dev.pekelund.shelfscan.scanner.ai;

/**
 * How the names of a name-only list were obtained.
 */
public enum FallbackTier {

    /**
     * Names corrected by the generative model.
     */
    AI_CLEANED("ai_extraction", 0.85),

    /**
     * OCR lines taken verbatim after the model could not be used.
     */
    RAW_LINES("raw_lines", 0.6);

    private final String mappingField;
    private final double nameConfidence;

    FallbackTier(String mappingField, double nameConfidence) {
        this.mappingField = mappingField;
        this.nameConfidence = nameConfidence;
    }

    public String mappingField() {
        return mappingField;
    }

    public double nameConfidence() {
        return nameConfidence;
    }
}
