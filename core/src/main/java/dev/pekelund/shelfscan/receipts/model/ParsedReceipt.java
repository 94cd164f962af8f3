package dev.pekelund.shelfscan.receipts.model;

import java.util.List;

/**
 * Layout-neutral view of a receipt table: the detected column headers and the data rows below them.
 */
public record ParsedReceipt(List<String> headers, List<ParsedRow> rows, ReceiptFormatType formatType) {

    public ParsedReceipt {
        headers = headers != null ? List.copyOf(headers) : List.of();
        rows = rows != null ? List.copyOf(rows) : List.of();
        formatType = formatType != null ? formatType : ReceiptFormatType.UNKNOWN;
    }

    public static ParsedReceipt empty() {
        return new ParsedReceipt(List.of(), List.of(), ReceiptFormatType.UNKNOWN);
    }

    public boolean hasHeaders() {
        return !headers.isEmpty();
    }
}
