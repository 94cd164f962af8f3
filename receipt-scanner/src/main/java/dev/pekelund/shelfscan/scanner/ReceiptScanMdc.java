package dev.pekelund.shelfscan.scanner;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates mapped diagnostic context (MDC) entries so log lines emitted during one scan share the
 * same scan id and stage.
 */
final class ReceiptScanMdc {

    static final String KEY_SCAN_ID = "scan.id";
    static final String KEY_STAGE = "scan.stage";

    private ReceiptScanMdc() {
        // Utility class
    }

    static Context open(String scanId) {
        return new Context(scanId);
    }

    static void setStage(ScanStage stage) {
        if (stage == null) {
            MDC.remove(KEY_STAGE);
        } else {
            MDC.put(KEY_STAGE, stage.value());
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String scanId) {
            this.previous = MDC.getCopyOfContextMap();
            if (StringUtils.hasText(scanId)) {
                MDC.put(KEY_SCAN_ID, scanId);
            } else {
                MDC.remove(KEY_SCAN_ID);
            }
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
