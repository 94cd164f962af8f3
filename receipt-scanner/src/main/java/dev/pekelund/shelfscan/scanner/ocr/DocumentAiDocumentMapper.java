package dev.pekelund.shelfscan.scanner.ocr;

import com.google.cloud.documentai.v1.Document;
import com.google.cloud.documentai.v1.NormalizedVertex;
import dev.pekelund.shelfscan.receipts.model.BoundingBox;
import java.util.ArrayList;
import java.util.List;
import org.springframework.util.StringUtils;

/**
 * Maps a Document AI {@link Document} onto an {@link OcrAnalysis}.
 *
 * <p>Table header rows come first, followed by body rows. Row and column indexes are 1-based and a cell
 * spanning several columns advances the column index by its span. Confidences are converted from the
 * [0, 1] range Document AI reports into percentages.</p>
 */
public class DocumentAiDocumentMapper {

    public OcrAnalysis toAnalysis(Document document) {
        if (document == null) {
            return new OcrAnalysis(List.of(), List.of(), List.of());
        }
        String text = document.getText();
        List<String> lines = new ArrayList<>();
        List<OcrTable> tables = new ArrayList<>();
        List<OcrKeyValuePair> keyValuePairs = new ArrayList<>();

        for (Document.Page page : document.getPagesList()) {
            for (Document.Page.Line line : page.getLinesList()) {
                String lineText = textOf(line.getLayout(), text).trim();
                if (!lineText.isEmpty()) {
                    lines.add(lineText);
                }
            }
            for (Document.Page.Table table : page.getTablesList()) {
                tables.add(toTable(table, text));
            }
            for (Document.Page.FormField field : page.getFormFieldsList()) {
                String key = textOf(field.getFieldName(), text).trim();
                if (StringUtils.hasText(key)) {
                    keyValuePairs.add(new OcrKeyValuePair(key, textOf(field.getFieldValue(), text).trim(),
                        percentage(field.getFieldValue().getConfidence())));
                }
            }
        }
        return new OcrAnalysis(lines, tables, keyValuePairs);
    }

    private OcrTable toTable(Document.Page.Table table, String text) {
        List<OcrCell> cells = new ArrayList<>();
        int rowIndex = 1;
        for (Document.Page.Table.TableRow row : table.getHeaderRowsList()) {
            addRow(cells, row, rowIndex++, text);
        }
        for (Document.Page.Table.TableRow row : table.getBodyRowsList()) {
            addRow(cells, row, rowIndex++, text);
        }
        return new OcrTable(cells, percentage(table.getLayout().getConfidence()));
    }

    private void addRow(List<OcrCell> cells, Document.Page.Table.TableRow row, int rowIndex, String text) {
        int columnIndex = 1;
        for (Document.Page.Table.TableCell cell : row.getCellsList()) {
            Document.Page.Layout layout = cell.getLayout();
            cells.add(new OcrCell(textOf(layout, text).trim(), rowIndex, columnIndex,
                percentage(layout.getConfidence()), boundingBox(layout)));
            columnIndex += Math.max(cell.getColSpan(), 1);
        }
    }

    static String textOf(Document.Page.Layout layout, String text) {
        if (layout == null || !layout.hasTextAnchor() || text == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (Document.TextAnchor.TextSegment segment : layout.getTextAnchor().getTextSegmentsList()) {
            int start = (int) Math.max(0, segment.getStartIndex());
            int end = (int) Math.min(text.length(), segment.getEndIndex());
            if (start < end) {
                builder.append(text, start, end);
            }
        }
        return builder.toString();
    }

    private static BoundingBox boundingBox(Document.Page.Layout layout) {
        List<NormalizedVertex> vertices = layout.getBoundingPoly().getNormalizedVerticesList();
        if (vertices.isEmpty()) {
            return null;
        }
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (NormalizedVertex vertex : vertices) {
            minX = Math.min(minX, vertex.getX());
            minY = Math.min(minY, vertex.getY());
            maxX = Math.max(maxX, vertex.getX());
            maxY = Math.max(maxY, vertex.getY());
        }
        return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
    }

    private static Double percentage(float confidence) {
        return confidence > 0 ? confidence * 100.0 : null;
    }
}
