package dev.pekelund.shelfscan.receipts.mapping;

/**
 * Resolved column indexes for one receipt.
 *
 * <p>{@code netAmount} always points at the authoritative price column, whether that column was a net,
 * MRP or gross amount header. {@code mrp} and {@code grossAmount} are only set when those headers exist
 * and were not promoted to the price column.</p>
 */
public record ColumnMapping(int productName, int quantity, int netAmount, Integer mrp, Integer grossAmount) {
}
