package dev.pekelund.shelfscan.receipts.serialization;

/**
 * Signals that a serialized receipt could not be written or read.
 */
public class ReceiptSerializationException extends RuntimeException {

    public ReceiptSerializationException(String message) {
        super(message);
    }

    public ReceiptSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
