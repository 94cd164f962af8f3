package dev.pekelund.shelfscan.scanner.ai;

import java.util.List;

/**
 * Product names recovered from a list without prices. {@code error} is set when nothing could be
 * recovered; {@code note} explains a degraded but successful extraction.
 */
public record NameOnlyExtraction(FallbackTier tier, List<String> names, String note, String error) {

    public NameOnlyExtraction {
        names = names != null ? List.copyOf(names) : List.of();
    }

    static NameOnlyExtraction aiCleaned(List<String> names) {
        return new NameOnlyExtraction(FallbackTier.AI_CLEANED, names, null, null);
    }

    static NameOnlyExtraction rawLines(List<String> lines, String note) {
        return new NameOnlyExtraction(FallbackTier.RAW_LINES, lines, note, null);
    }

    static NameOnlyExtraction failed(String error) {
        return new NameOnlyExtraction(null, List.of(), null, error);
    }

    public boolean success() {
        return error == null && !names.isEmpty();
    }
}
