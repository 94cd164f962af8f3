package dev.pekelund.shelfscan.scanner.ai;

import dev.pekelund.shelfscan.scanner.ReceiptScanException;

/**
 * Signals that the generative model has not been configured.
 */
public class AiConfigurationException extends ReceiptScanException {

    public AiConfigurationException(String message) {
        super(message);
    }
}
