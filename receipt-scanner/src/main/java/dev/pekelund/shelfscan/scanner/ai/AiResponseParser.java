package dev.pekelund.shelfscan.scanner.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Reads product names out of free-form model output.
 *
 * <p>Accepts a bare JSON array of names or an object of the form
 * {@code {"imageType": ..., "products": [{"name": ...}]}}. Markdown code fences are removed first, and
 * when the text is still not JSON the first array or object embedded in it is tried.</p>
 */
public class AiResponseParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(AiResponseParser.class);

    private final ObjectMapper objectMapper;

    public AiResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> parseProductNames(String response) {
        if (!StringUtils.hasText(response)) {
            throw new AiResponseParseException("Model returned an empty response");
        }
        JsonNode root = readJson(sanitiseResponse(response));
        List<String> names = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(element -> addName(names, element));
        } else if (root.isObject() && root.path("products").isArray()) {
            root.get("products").forEach(element -> addName(names, element));
            LOGGER.info("Model classified the image as '{}'", root.path("imageType").asText("unknown"));
        } else {
            throw new AiResponseParseException("Model response is neither a name array nor a product list");
        }
        return names;
    }

    private static void addName(List<String> names, JsonNode element) {
        JsonNode value = element.isObject() ? element.get("name") : element;
        if (value != null && value.isTextual() && StringUtils.hasText(value.textValue())) {
            names.add(value.textValue().trim());
        }
    }

    private JsonNode readJson(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException ex) {
            String embedded = embeddedJson(text);
            if (embedded == null) {
                LOGGER.warn("Model response is not JSON. Payload begins with: {}", preview(text));
                throw new AiResponseParseException("Model response could not be parsed as JSON", ex);
            }
            try {
                return objectMapper.readTree(embedded);
            } catch (JsonProcessingException nested) {
                LOGGER.warn("Embedded JSON in model response is malformed. Payload begins with: {}", preview(text));
                throw new AiResponseParseException("Model response could not be parsed as JSON", nested);
            }
        }
    }

    private static String embeddedJson(String text) {
        int arrayStart = text.indexOf('[');
        int objectStart = text.indexOf('{');
        boolean arrayFirst = arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart);
        int start = arrayFirst ? arrayStart : objectStart;
        int end = arrayFirst ? text.lastIndexOf(']') : text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }

    static String sanitiseResponse(String response) {
        String trimmed = response.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            int firstBreak = trimmed.indexOf('\n');
            if (firstBreak > 0) {
                LOGGER.debug("Removing code fence declared as '{}'", trimmed.substring(3, firstBreak).trim());
                trimmed = trimmed.substring(firstBreak + 1, trimmed.length() - 3).trim();
            } else {
                trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            }
        }
        if (trimmed.length() >= 2 && trimmed.startsWith("`") && trimmed.endsWith("`")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private static String preview(String response) {
        int max = Math.min(response.length(), 256);
        return response.substring(0, max);
    }
}
