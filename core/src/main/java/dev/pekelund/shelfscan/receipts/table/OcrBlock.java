package dev.pekelund.shelfscan.receipts.table;

import dev.pekelund.shelfscan.receipts.model.BoundingBox;
import java.util.List;

/**
 * One node of the OCR block graph.
 *
 * <p>Which optional fields are set depends on the block type: TABLE blocks list their CELL children,
 * CELL blocks carry 1-based row and column indices and may list WORD children, WORD and LINE blocks
 * carry text. {@code confidence} is a percentage in the range [0, 100].</p>
 */
public record OcrBlock(
    String id,
    BlockType type,
    String text,
    Integer rowIndex,
    Integer columnIndex,
    Double confidence,
    BoundingBox geometry,
    List<String> childIds
) {

    public OcrBlock {
        childIds = childIds != null ? List.copyOf(childIds) : List.of();
    }

    public static OcrBlock line(String id, String text, Double confidence, BoundingBox geometry) {
        return new OcrBlock(id, BlockType.LINE, text, null, null, confidence, geometry, List.of());
    }

    public static OcrBlock word(String id, String text, Double confidence) {
        return new OcrBlock(id, BlockType.WORD, text, null, null, confidence, null, List.of());
    }

    public static OcrBlock cell(String id, String text, Integer rowIndex, Integer columnIndex, Double confidence,
        BoundingBox geometry, List<String> wordIds) {
        return new OcrBlock(id, BlockType.CELL, text, rowIndex, columnIndex, confidence, geometry, wordIds);
    }

    public static OcrBlock table(String id, Double confidence, List<String> cellIds) {
        return new OcrBlock(id, BlockType.TABLE, null, null, null, confidence, null, cellIds);
    }
}
