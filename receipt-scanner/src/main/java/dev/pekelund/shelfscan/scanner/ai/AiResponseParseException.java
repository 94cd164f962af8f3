package dev.pekelund.shelfscan.scanner.ai;

import dev.pekelund.shelfscan.scanner.ReceiptScanException;

/**
 * Signals that a model response did not contain the expected JSON.
 */
public class AiResponseParseException extends ReceiptScanException {

    public AiResponseParseException(String message) {
        super(message);
    }

    public AiResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
