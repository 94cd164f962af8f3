package dev.pekelund.shelfscan.scanner.ocr;

import dev.pekelund.shelfscan.scanner.ReceiptScanException;

/**
 * Signals that the OCR service is missing credentials or a processor. Retrying will not help.
 */
public class OcrConfigurationException extends ReceiptScanException {

    public OcrConfigurationException(String message) {
        super(message);
    }
}
