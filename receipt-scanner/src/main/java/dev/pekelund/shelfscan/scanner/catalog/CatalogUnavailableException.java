package dev.pekelund.shelfscan.scanner.catalog;

import dev.pekelund.shelfscan.scanner.ReceiptScanException;

/**
 * Raised when the product catalog could not be read.
 */
public class CatalogUnavailableException extends ReceiptScanException {

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
