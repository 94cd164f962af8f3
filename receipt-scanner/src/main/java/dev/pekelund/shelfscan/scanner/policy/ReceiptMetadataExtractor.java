package dev.pekelund.shelfscan.scanner.policy;

import dev.pekelund.shelfscan.receipts.model.ReceiptFormatType;
import dev.pekelund.shelfscan.receipts.model.ReceiptMetadata;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.util.StringUtils;

/**
 * Pulls merchant, invoice number, date and total out of raw OCR lines with simple patterns.
 */
public class ReceiptMetadataExtractor {

    private static final int MERCHANT_CANDIDATE_LINES = 5;
    private static final int MIN_MERCHANT_LENGTH = 4;

    private static final Pattern DATE = Pattern.compile("(\\d{1,2}[/\\-]\\d{1,2}[/\\-]\\d{2,4})");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern BARE_NUMBER = Pattern.compile("^[\\d\\s.,/\\-]+$");
    private static final Pattern NON_MERCHANT_PREFIX = Pattern.compile("^(invoice|receipt|bill|tax)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern INVOICE_NUMBER = Pattern.compile(
        "(?:invoice|inv|bill)\\s*(?:no|#|number)?[:\\s]*([A-Z0-9\\-/]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOTAL = Pattern.compile(
        "(?:total|grand\\s*total|net\\s*total)[:\\s]*(?:rs\\.?|₹)?\\s*([0-9,]+\\.?\\d*)", Pattern.CASE_INSENSITIVE);

    public ReceiptMetadata extract(List<String> lines, ReceiptFormatType formatType) {
        if (lines == null || lines.isEmpty()) {
            return new ReceiptMetadata(formatType, null, null, null, null);
        }
        List<String> trimmed = lines.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(StringUtils::hasText)
            .collect(Collectors.toList());
        String text = String.join("\n", trimmed);
        return new ReceiptMetadata(formatType, merchantName(trimmed), firstGroup(INVOICE_NUMBER, text),
            firstGroup(DATE, text), totalAmount(text));
    }

    private static String merchantName(List<String> lines) {
        return lines.stream()
            .limit(MERCHANT_CANDIDATE_LINES)
            .filter(line -> line.length() >= MIN_MERCHANT_LENGTH)
            .filter(line -> !DATE.matcher(line).find())
            .filter(line -> !BARE_NUMBER.matcher(line).matches())
            .filter(line -> !NON_MERCHANT_PREFIX.matcher(line.toLowerCase(Locale.ROOT)).find())
            .findFirst()
            .orElse(null);
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static Double totalAmount(String text) {
        String amount = firstGroup(TOTAL, text);
        if (amount == null) {
            return null;
        }
        String digits = amount.replace(",", "");
        if (!DIGIT.matcher(digits).find()) {
            return null;
        }
        return Double.valueOf(digits);
    }
}
