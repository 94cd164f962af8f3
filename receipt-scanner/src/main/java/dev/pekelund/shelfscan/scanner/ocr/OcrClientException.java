package dev.pekelund.shelfscan.scanner.ocr;

import dev.pekelund.shelfscan.scanner.ReceiptScanException;

/**
 * Signals that the OCR service could not be reached or failed to analyse an image.
 */
public class OcrClientException extends ReceiptScanException {

    public OcrClientException(String message) {
        super(message);
    }

    public OcrClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
