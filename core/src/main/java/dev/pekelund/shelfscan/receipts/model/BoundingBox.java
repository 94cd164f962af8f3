package dev.pekelund.shelfscan.receipts.model;

/**
 * Normalized position of an OCR element on the page. All coordinates are fractions of the page
 * size in the range [0, 1].
 */
public record BoundingBox(double left, double top, double width, double height) {
}
