package dev.pekelund.shelfscan.scanner.ocr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.google.cloud.documentai.v1.BoundingPoly;
import com.google.cloud.documentai.v1.Document;
import com.google.cloud.documentai.v1.NormalizedVertex;
import org.junit.jupiter.api.Test;

class DocumentAiDocumentMapperTest {

    private static final String TEXT = "ABC Traders\nItem Qty Amount\nMaggi 5 100\nGSTIN: 29ABCDE\n";

    private final DocumentAiDocumentMapper mapper = new DocumentAiDocumentMapper();

    @Test
    void mapsLinesTablesAndFormFields() {
        Document document = Document.newBuilder()
            .setText(TEXT)
            .addPages(Document.Page.newBuilder()
                .addLines(line(0, 12))
                .addLines(line(12, 27))
                .addLines(line(27, 39))
                .addTables(Document.Page.Table.newBuilder()
                    .setLayout(Document.Page.Layout.newBuilder().setConfidence(0.9f))
                    .addHeaderRows(Document.Page.Table.TableRow.newBuilder()
                        .addCells(cell(12, 16, 1, 0.99f))
                        .addCells(cell(17, 20, 1, 0.98f))
                        .addCells(cell(21, 27, 1, 0.97f)))
                    .addBodyRows(Document.Page.Table.TableRow.newBuilder()
                        .addCells(cell(28, 33, 2, 0.95f))
                        .addCells(cell(36, 39, 1, 0f))))
                .addFormFields(Document.Page.FormField.newBuilder()
                    .setFieldName(layout(40, 45, 0.8f))
                    .setFieldValue(layout(47, 54, 0.7f))))
            .build();

        OcrAnalysis analysis = mapper.toAnalysis(document);

        assertThat(analysis.textLines()).containsExactly("ABC Traders", "Item Qty Amount", "Maggi 5 100");
        assertThat(analysis.tables()).hasSize(1);
        OcrTable table = analysis.tables().get(0);
        assertThat(table.confidence()).isCloseTo(90.0, within(1e-3));
        assertThat(table.cells()).extracting(OcrCell::text)
            .containsExactly("Item", "Qty", "Amount", "Maggi", "100");
        assertThat(table.cells()).extracting(OcrCell::rowIndex).containsExactly(1, 1, 1, 2, 2);
        assertThat(table.cells()).extracting(OcrCell::columnIndex).containsExactly(1, 2, 3, 1, 3);
        assertThat(table.cells().get(0).confidence()).isCloseTo(99.0, within(1e-3));
        assertThat(table.cells().get(4).confidence()).isNull();
        assertThat(table.cells().get(0).geometry().left()).isCloseTo(0.1, within(1e-6));
        assertThat(table.cells().get(0).geometry().width()).isCloseTo(0.2, within(1e-6));

        assertThat(analysis.keyValuePairs()).singleElement().satisfies(pair -> {
            assertThat(pair.key()).isEqualTo("GSTIN");
            assertThat(pair.value()).isEqualTo("29ABCDE");
        });
    }

    @Test
    void nullDocumentIsEmpty() {
        assertThat(mapper.toAnalysis(null).isEmpty()).isTrue();
    }

    @Test
    void textOfIgnoresSegmentsOutsideTheText() {
        Document.Page.Layout layout = layout(6, 500, 0.5f);

        assertThat(DocumentAiDocumentMapper.textOf(layout, "short text")).isEqualTo("text");
    }

    private static Document.Page.Line line(int start, int end) {
        return Document.Page.Line.newBuilder().setLayout(layout(start, end, 0.9f)).build();
    }

    private static Document.Page.Table.TableCell cell(int start, int end, int colSpan, float confidence) {
        Document.Page.Layout layout = layout(start, end, confidence).toBuilder()
            .setBoundingPoly(BoundingPoly.newBuilder()
                .addNormalizedVertices(NormalizedVertex.newBuilder().setX(0.1f).setY(0.2f))
                .addNormalizedVertices(NormalizedVertex.newBuilder().setX(0.3f).setY(0.2f))
                .addNormalizedVertices(NormalizedVertex.newBuilder().setX(0.3f).setY(0.25f))
                .addNormalizedVertices(NormalizedVertex.newBuilder().setX(0.1f).setY(0.25f)))
            .build();
        return Document.Page.Table.TableCell.newBuilder().setLayout(layout).setColSpan(colSpan).build();
    }

    private static Document.Page.Layout layout(int start, int end, float confidence) {
        return Document.Page.Layout.newBuilder()
            .setConfidence(confidence)
            .setTextAnchor(Document.TextAnchor.newBuilder()
                .addTextSegments(Document.TextAnchor.TextSegment.newBuilder()
                    .setStartIndex(start)
                    .setEndIndex(end)))
            .build();
    }
}
