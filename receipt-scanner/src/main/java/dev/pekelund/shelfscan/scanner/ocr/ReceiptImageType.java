package dev.pekelund.shelfscan.scanner.ocr;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Image formats accepted for scanning, recognised by their leading bytes.
 */
public enum ReceiptImageType {
    JPEG("image/jpeg"),
    PNG("image/png"),
    WEBP("image/webp");

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    private final String mimeType;

    ReceiptImageType(String mimeType) {
        this.mimeType = mimeType;
    }

    public String mimeType() {
        return mimeType;
    }

    public static Optional<ReceiptImageType> detect(byte[] content) {
        if (content == null) {
            return Optional.empty();
        }
        if (content.length >= 3 && (content[0] & 0xFF) == 0xFF && (content[1] & 0xFF) == 0xD8
            && (content[2] & 0xFF) == 0xFF) {
            return Optional.of(JPEG);
        }
        if (startsWith(content, PNG_SIGNATURE, 0)) {
            return Optional.of(PNG);
        }
        if (startsWith(content, "RIFF".getBytes(StandardCharsets.US_ASCII), 0)
            && startsWith(content, "WEBP".getBytes(StandardCharsets.US_ASCII), 8)) {
            return Optional.of(WEBP);
        }
        return Optional.empty();
    }

    private static boolean startsWith(byte[] content, byte[] prefix, int offset) {
        if (content.length < offset + prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
