package dev.pekelund.shelfscan.scanner.ai;

import dev.pekelund.shelfscan.scanner.ocr.ReceiptImageType;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

/**
 * Recovers product names from documents that could not be read as a table, typically handwritten
 * shopping or stock lists.
 *
 * <p>The OCR lines are cleaned and sent to the generative model for spelling correction. When the model
 * is not configured, fails, or answers with something that is not a list of names, the cleaned lines are
 * used verbatim instead. Without any usable line the image itself is sent to the model.</p>
 */
public class NameOnlyListExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(NameOnlyListExtractor.class);

    static final String NO_TEXT_ERROR = "No text detected in the image";

    private static final Pattern LETTER = Pattern.compile("[a-zA-Z]");
    private static final Pattern BARE_DATE = Pattern.compile("^\\d{1,2}[/\\-]\\d{1,2}[/\\-]\\d{2,4}$");
    private static final int MIN_LINE_LENGTH = 3;

    private static final String NAME_CLEANUP_INSTRUCTIONS = """
        You correct product names that were read by OCR from a handwritten or printed product list.
        Every input line is exactly one product. Keep all of them and keep their order.
        Fix obvious OCR spelling mistakes and capitalise names properly. Well known Indian FMCG brands
        such as Maggi, Amul, Parle, Britannia, Horlicks, Bournvita, Dettol, Lux, Dove and Cadbury are common.
        Keep sizes and weights such as 110g or 2kg as part of the name.
        Return only a JSON array of strings, one corrected name per input line, without code fences or commentary.
        """;

    private static final String IMAGE_INSTRUCTIONS = """
        The attached image shows a receipt or a product list. Read every product on it.
        Return only a JSON object of the form
        {"imageType": "receipt|product_list|name_only_list|invoice|unknown",
         "products": [{"name": "Product Name", "price": 0, "quantity": 1, "unit": "pieces", "confidence": 0.9}]}
        Use price 0 and quantity 1 when they are not printed. Do not add code fences or commentary.
        """;

    private final ChatModel chatModel;
    private final ChatOptions chatOptions;
    private final AiResponseParser responseParser;

    public NameOnlyListExtractor(ChatModel chatModel, ChatOptions chatOptions, AiResponseParser responseParser) {
        this.chatModel = chatModel;
        this.chatOptions = chatOptions;
        this.responseParser = responseParser;
    }

    public boolean isModelConfigured() {
        return !(chatModel instanceof UnconfiguredChatModel);
    }

    public NameOnlyExtraction extract(List<String> ocrLines, byte[] image) {
        List<String> lines = preprocessLines(ocrLines);
        LOGGER.info("Name-only extraction with {} usable lines out of {}", lines.size(),
            ocrLines != null ? ocrLines.size() : 0);

        if (lines.isEmpty()) {
            return extractFromImage(image);
        }

        if (!isModelConfigured()) {
            LOGGER.info("Generative model not configured; using OCR lines as product names");
            return NameOnlyExtraction.rawLines(lines, "Generative model not configured. Using raw OCR text.");
        }

        try {
            List<String> names = responseParser.parseProductNames(call(new UserMessage(buildCleanupPrompt(lines))));
            if (names.isEmpty()) {
                LOGGER.warn("Model returned no product names; using OCR lines");
                return NameOnlyExtraction.rawLines(lines, "Model returned no product names. Using raw OCR text.");
            }
            LOGGER.info("Model corrected {} product names", names.size());
            return NameOnlyExtraction.aiCleaned(names);
        } catch (RuntimeException ex) {
            LOGGER.warn("Name cleanup failed ({}); using OCR lines as product names", ex.getMessage());
            return NameOnlyExtraction.rawLines(lines, "AI processing failed: " + ex.getMessage()
                + ". Using raw OCR text.");
        }
    }

    private NameOnlyExtraction extractFromImage(byte[] image) {
        if (image == null || image.length == 0 || !isModelConfigured()) {
            return NameOnlyExtraction.failed(NO_TEXT_ERROR);
        }
        String mimeType = ReceiptImageType.detect(image)
            .map(ReceiptImageType::mimeType)
            .orElse(ReceiptImageType.JPEG.mimeType());
        Media media = Media.builder()
            .mimeType(MimeTypeUtils.parseMimeType(mimeType))
            .data(image)
            .build();
        UserMessage message = UserMessage.builder()
            .text(IMAGE_INSTRUCTIONS)
            .media(List.of(media))
            .build();
        try {
            List<String> names = responseParser.parseProductNames(call(message));
            LOGGER.info("Model read {} product names directly from the image", names.size());
            return names.isEmpty() ? NameOnlyExtraction.failed(NO_TEXT_ERROR) : NameOnlyExtraction.aiCleaned(names);
        } catch (RuntimeException ex) {
            LOGGER.warn("Image based name extraction failed: {}", ex.getMessage());
            return NameOnlyExtraction.failed("AI extraction failed: " + ex.getMessage());
        }
    }

    private String call(UserMessage message) {
        ChatResponse response = chatModel.call(new Prompt(message, chatOptions));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new AiResponseParseException("Model returned no output");
        }
        return response.getResult().getOutput().getText();
    }

    static String buildCleanupPrompt(List<String> lines) {
        StringBuilder prompt = new StringBuilder(NAME_CLEANUP_INSTRUCTIONS);
        prompt.append('\n').append("<lines>\n");
        prompt.append(String.join("\n", lines));
        prompt.append("\n</lines>");
        return prompt.toString();
    }

    /**
     * Keeps trimmed lines that contain a letter, are at least three characters long and are not page
     * headers, date labels or bare dates.
     */
    static List<String> preprocessLines(List<String> lines) {
        if (lines == null) {
            return List.of();
        }
        return lines.stream()
            .filter(StringUtils::hasText)
            .map(String::trim)
            .filter(line -> LETTER.matcher(line).find())
            .filter(line -> line.length() >= MIN_LINE_LENGTH)
            .filter(line -> {
                String lower = line.toLowerCase(Locale.ROOT);
                return !lower.contains("date:") && !lower.contains("page") && !BARE_DATE.matcher(lower).matches();
            })
            .collect(Collectors.toList());
    }
}
