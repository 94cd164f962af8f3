package dev.pekelund.shelfscan.receipts.extraction;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits tax and product codes printed next to a product name.
 *
 * <p>Three patterns are tried in order, each anchored at the start or the end of the name and separated
 * from it by whitespace: a 4 to 8 digit HSN code, a 5 to 12 digit numeric code, and an alphanumeric
 * SKU-style code containing at least one digit. The first pattern that matches is removed.</p>
 */
public final class ProductCodeSeparator {

    private static final Pattern HSN_CODE = Pattern.compile("^(\\d{4,8})\\s+|\\s+(\\d{4,8})$");
    private static final Pattern NUMERIC_CODE = Pattern.compile("^(\\d{5,12})\\s+|\\s+(\\d{5,12})$");
    private static final Pattern PRODUCT_CODE = Pattern.compile(
        "^([A-Z]*\\d+[A-Z0-9]*[-/]?[A-Z0-9]*)\\s+|\\s+([A-Z]*\\d+[A-Z0-9]*[-/]?[A-Z0-9]*)$",
        Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> PATTERNS = List.of(HSN_CODE, NUMERIC_CODE, PRODUCT_CODE);

    private ProductCodeSeparator() {
    }

    /**
     * Separates the code from the name. The returned name is trimmed and may be empty when the text held
     * nothing but a code; the code is {@code null} when no pattern matched.
     */
    public static SeparatedName separate(String rawName) {
        String text = rawName != null ? rawName.trim() : "";
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String code = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
                String name = (text.substring(0, matcher.start()) + text.substring(matcher.end())).trim();
                return new SeparatedName(name, code);
            }
        }
        return new SeparatedName(text, null);
    }

    public record SeparatedName(String name, String code) {

        public boolean hasCode() {
            return code != null;
        }
    }
}
