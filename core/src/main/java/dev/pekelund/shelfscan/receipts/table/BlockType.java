package dev.pekelund.shelfscan.receipts.table;

/**
 * Kinds of blocks in an OCR document graph.
 */
public enum BlockType {
    TABLE,
    CELL,
    WORD,
    LINE
}
