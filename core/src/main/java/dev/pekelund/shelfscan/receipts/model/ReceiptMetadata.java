package dev.pekelund.shelfscan.receipts.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Best-effort receipt header information found in the OCR text. Every field except
 * {@code formatType} may be {@code null}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReceiptMetadata(
    ReceiptFormatType formatType,
    String merchantName,
    String invoiceNumber,
    String date,
    Double totalAmount
) {

    public ReceiptMetadata {
        formatType = formatType != null ? formatType : ReceiptFormatType.UNKNOWN;
    }

    public static ReceiptMetadata unknown() {
        return new ReceiptMetadata(ReceiptFormatType.UNKNOWN, null, null, null, null);
    }
}
