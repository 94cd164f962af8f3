package dev.pekelund.shelfscan.receipts.serialization;

import dev.pekelund.shelfscan.receipts.model.CellData;
import dev.pekelund.shelfscan.receipts.model.ParsedReceipt;
import dev.pekelund.shelfscan.receipts.model.ParsedRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link ParsedReceipt} as column-aligned text for debugging.
 */
public class ParsedReceiptPrinter {

    private static final int MIN_COLUMN_WIDTH = 10;
    private static final String BANNER = "=".repeat(60);
    private static final String RULE = "-".repeat(40);

    public String prettyPrint(ParsedReceipt receipt) {
        List<String> lines = new ArrayList<>();
        lines.add(BANNER);
        lines.add("Receipt Format: " + receipt.formatType().value());
        lines.add(BANNER);
        lines.add("");

        List<String> headers = receipt.headers();
        if (!headers.isEmpty()) {
            lines.add("Headers:");
            lines.add(RULE);
            List<String> paddedHeaders = new ArrayList<>(headers.size());
            for (int i = 0; i < headers.size(); i++) {
                paddedHeaders.add(padRight(headers.get(i), columnWidth(receipt, i)));
            }
            String headerLine = String.join(" | ", paddedHeaders);
            lines.add(headerLine);
            lines.add("-".repeat(headerLine.length()));
        }

        if (receipt.rows().isEmpty()) {
            lines.add("");
            lines.add("No data rows found.");
        } else {
            lines.add("");
            lines.add("Data Rows (" + receipt.rows().size() + " total):");
            lines.add(RULE);
            for (int i = 0; i < receipt.rows().size(); i++) {
                ParsedRow row = receipt.rows().get(i);
                lines.add("Row " + (i + 1) + ":");
                for (CellData cell : row.cells()) {
                    lines.add(String.format(Locale.ROOT, "  %s: \"%s\" (confidence: %.1f%%)",
                        headerFor(headers, cell.columnIndex()), cell.text(), cell.confidence() * 100));
                }
                lines.add("  Raw: \"" + row.rawText() + "\"");
                lines.add("");
            }
        }
        return String.join("\n", lines);
    }

    private static int columnWidth(ParsedReceipt receipt, int columnIndex) {
        int width = Math.max(receipt.headers().get(columnIndex).length(), MIN_COLUMN_WIDTH);
        for (ParsedRow row : receipt.rows()) {
            int cellWidth = row.cellAt(columnIndex).map(cell -> cell.text().length()).orElse(0);
            width = Math.max(width, cellWidth);
        }
        return width;
    }

    private static String headerFor(List<String> headers, int columnIndex) {
        if (columnIndex >= 0 && columnIndex < headers.size() && !headers.get(columnIndex).isEmpty()) {
            return headers.get(columnIndex);
        }
        return "Col " + columnIndex;
    }

    private static String padRight(String value, int width) {
        StringBuilder builder = new StringBuilder(value);
        while (builder.length() < width) {
            builder.append(' ');
        }
        return builder.toString();
    }
}
