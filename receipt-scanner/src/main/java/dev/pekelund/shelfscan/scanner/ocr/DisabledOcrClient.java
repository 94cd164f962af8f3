package dev.pekelund.shelfscan.scanner.ocr;

/**
 * Used when no OCR processor is configured. Every analysis fails with a configuration error.
 */
public class DisabledOcrClient implements OcrClient {

    private final String reason;

    public DisabledOcrClient(String reason) {
        this.reason = reason;
    }

    @Override
    public OcrAnalysis analyze(byte[] image) {
        throw new OcrConfigurationException(reason);
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
