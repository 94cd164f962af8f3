package dev.pekelund.shelfscan.scanner.ocr;

import dev.pekelund.shelfscan.receipts.table.OcrBlock;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts an {@link OcrAnalysis} into the block graph consumed by the table builder: one LINE block
 * per text line, and per table its CELL blocks followed by a TABLE block that lists them.
 */
public class OcrBlockGraphFactory {

    static final double DEFAULT_CONFIDENCE = 90.0;

    public List<OcrBlock> toBlocks(OcrAnalysis analysis) {
        List<OcrBlock> blocks = new ArrayList<>();
        if (analysis == null) {
            return blocks;
        }

        int lineIndex = 0;
        for (String line : analysis.textLines()) {
            blocks.add(OcrBlock.line("line_" + lineIndex++, line, DEFAULT_CONFIDENCE, null));
        }

        for (int tableIndex = 0; tableIndex < analysis.tables().size(); tableIndex++) {
            OcrTable table = analysis.tables().get(tableIndex);
            List<String> cellIds = new ArrayList<>(table.cells().size());
            for (int cellIndex = 0; cellIndex < table.cells().size(); cellIndex++) {
                OcrCell cell = table.cells().get(cellIndex);
                String cellId = "cell_" + tableIndex + "_" + cellIndex;
                cellIds.add(cellId);
                blocks.add(OcrBlock.cell(cellId, cell.text() != null ? cell.text() : "", cell.rowIndex(),
                    cell.columnIndex(), confidenceOrDefault(cell.confidence()), cell.geometry(), List.of()));
            }
            blocks.add(OcrBlock.table("table_" + tableIndex, confidenceOrDefault(table.confidence()), cellIds));
        }
        return blocks;
    }

    private static double confidenceOrDefault(Double confidence) {
        if (confidence == null || confidence == 0 || confidence.isNaN()) {
            return DEFAULT_CONFIDENCE;
        }
        return confidence;
    }
}
