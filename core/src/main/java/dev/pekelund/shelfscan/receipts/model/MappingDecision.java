package dev.pekelund.shelfscan.receipts.model;

/**
 * Audit entry describing how a header (or a fallback step) was classified. Used for diagnostics only.
 */
public record MappingDecision(String headerText, String assignedField, double confidence, String reason) {
}
