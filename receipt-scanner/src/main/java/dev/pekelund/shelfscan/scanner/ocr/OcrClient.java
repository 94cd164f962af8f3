package dev.pekelund.shelfscan.scanner.ocr;

/**
 * Document analysis service that reads text lines and tables from an image.
 */
public interface OcrClient {

    /**
     * Analyses the image.
     *
     * @throws OcrConfigurationException when the service is not configured
     * @throws OcrClientException when the service call fails
     */
    OcrAnalysis analyze(byte[] image);

    /**
     * Whether {@link #analyze(byte[])} can be expected to reach a real service.
     */
    default boolean isConfigured() {
        return true;
    }
}
