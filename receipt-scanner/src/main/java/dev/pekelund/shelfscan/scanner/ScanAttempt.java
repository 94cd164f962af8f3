package dev.pekelund.shelfscan.scanner;

import dev.pekelund.shelfscan.receipts.model.MappingDecision;
import dev.pekelund.shelfscan.receipts.model.ReceiptMetadata;
import dev.pekelund.shelfscan.receipts.model.ScanResult;
import java.util.List;

/**
 * Outcome of the structured part of a scan: either a finished {@link ScanResult} or a request to
 * continue with the name-only fallback.
 *
 * <p>When the fallback is needed, {@code error} is the message reported if it cannot run,
 * {@code lines} are the OCR text lines available to it and {@code mappingLog} holds the decisions
 * made before the structured path gave up.</p>
 */
record ScanAttempt(
    ScanResult result,
    String error,
    List<String> lines,
    List<MappingDecision> mappingLog,
    ReceiptMetadata metadata,
    boolean fallbackPermitted
) {

    static ScanAttempt completed(ScanResult result) {
        return new ScanAttempt(result, null, List.of(), List.of(), result.metadata(), false);
    }

    static ScanAttempt needsFallback(String error, List<String> lines, List<MappingDecision> mappingLog,
        ReceiptMetadata metadata) {
        return new ScanAttempt(null, error, lines, mappingLog, metadata, true);
    }

    static ScanAttempt terminal(String error, List<MappingDecision> mappingLog, ReceiptMetadata metadata) {
        return new ScanAttempt(null, error, List.of(), mappingLog, metadata, false);
    }

    boolean isCompleted() {
        return result != null;
    }
}
