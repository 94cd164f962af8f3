package dev.pekelund.shelfscan.receipts.extraction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient number parsing for OCR cell text such as {@code "Rs. 1,250.00"} or {@code "5 pcs"}.
 */
public final class ReceiptNumbers {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.]");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+\\.?\\d*|\\.\\d+)");

    private ReceiptNumbers() {
    }

    /**
     * Strips everything but digits and dots and reads the leading number. Returns {@code defaultValue}
     * when the text is empty, holds no number, or parses to zero.
     */
    public static double parseOrDefault(String text, double defaultValue) {
        if (text == null) {
            return defaultValue;
        }
        String digits = NON_NUMERIC.matcher(text).replaceAll("");
        Matcher matcher = LEADING_NUMBER.matcher(digits);
        if (!matcher.find()) {
            return defaultValue;
        }
        double value = Double.parseDouble(matcher.group(1));
        if (value == 0 || Double.isNaN(value)) {
            return defaultValue;
        }
        return value;
    }
}
