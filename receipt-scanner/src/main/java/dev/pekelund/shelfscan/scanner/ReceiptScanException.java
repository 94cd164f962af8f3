package dev.pekelund.shelfscan.scanner;

/**
 * Base type for failures raised by the collaborators of the receipt scanner.
 */
public class ReceiptScanException extends RuntimeException {

    public ReceiptScanException(String message) {
        super(message);
    }

    public ReceiptScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
