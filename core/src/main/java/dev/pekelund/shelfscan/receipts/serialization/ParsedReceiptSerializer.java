package dev.pekelund.shelfscan.receipts.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.shelfscan.receipts.model.BoundingBox;
import dev.pekelund.shelfscan.receipts.model.CellData;
import dev.pekelund.shelfscan.receipts.model.ParsedReceipt;
import dev.pekelund.shelfscan.receipts.model.ParsedRow;
import dev.pekelund.shelfscan.receipts.model.ReceiptFormatType;
import java.util.ArrayList;
import java.util.List;
import org.springframework.util.StringUtils;

/**
 * Reads and writes {@link ParsedReceipt} instances as JSON.
 *
 * <p>Reading is strict: every field must be present with the expected JSON type, nothing is coerced,
 * and any violation raises {@link ReceiptSerializationException} naming the offending path.</p>
 */
public class ParsedReceiptSerializer {

    private final ObjectMapper objectMapper;

    public ParsedReceiptSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String serialize(ParsedReceipt receipt) {
        if (receipt == null) {
            throw new ReceiptSerializationException("Cannot serialize a null receipt");
        }
        try {
            return objectMapper.writeValueAsString(receipt);
        } catch (JsonProcessingException ex) {
            throw new ReceiptSerializationException("Failed to serialize parsed receipt", ex);
        }
    }

    public ParsedReceipt deserialize(String json) {
        if (!StringUtils.hasText(json)) {
            throw new ReceiptSerializationException("Serialized receipt is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ReceiptSerializationException("Serialized receipt is not valid JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new ReceiptSerializationException("Serialized receipt must be a JSON object");
        }

        List<String> headers = readHeaders(root.get("headers"));
        List<ParsedRow> rows = readRows(root.get("rows"));
        ReceiptFormatType formatType = readFormatType(root.get("formatType"));
        return new ParsedReceipt(headers, rows, formatType);
    }

    private List<String> readHeaders(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new ReceiptSerializationException("'headers' must be an array");
        }
        List<String> headers = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode header = node.get(i);
            if (!header.isTextual()) {
                throw new ReceiptSerializationException("'headers[" + i + "]' must be a string");
            }
            headers.add(header.textValue());
        }
        return headers;
    }

    private List<ParsedRow> readRows(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new ReceiptSerializationException("'rows' must be an array");
        }
        List<ParsedRow> rows = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            rows.add(readRow(node.get(i), "rows[" + i + "]"));
        }
        return rows;
    }

    private ParsedRow readRow(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new ReceiptSerializationException("'" + path + "' must be an object");
        }
        JsonNode cellsNode = node.get("cells");
        if (cellsNode == null || !cellsNode.isArray()) {
            throw new ReceiptSerializationException("'" + path + ".cells' must be an array");
        }
        JsonNode rawText = node.get("rawText");
        if (rawText == null || !rawText.isTextual()) {
            throw new ReceiptSerializationException("'" + path + ".rawText' must be a string");
        }
        List<CellData> cells = new ArrayList<>(cellsNode.size());
        for (int i = 0; i < cellsNode.size(); i++) {
            cells.add(readCell(cellsNode.get(i), path + ".cells[" + i + "]"));
        }
        return new ParsedRow(cells, rawText.textValue());
    }

    private CellData readCell(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new ReceiptSerializationException("'" + path + "' must be an object");
        }
        JsonNode text = node.get("text");
        if (text == null || !text.isTextual()) {
            throw new ReceiptSerializationException("'" + path + ".text' must be a string");
        }
        int columnIndex = requireInt(node.get("columnIndex"), path + ".columnIndex");
        int rowIndex = requireInt(node.get("rowIndex"), path + ".rowIndex");
        double confidence = requireNumber(node.get("confidence"), path + ".confidence");
        BoundingBox boundingBox = readBoundingBox(node.get("boundingBox"), path + ".boundingBox");
        return new CellData(text.textValue(), columnIndex, rowIndex, confidence, boundingBox);
    }

    private BoundingBox readBoundingBox(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new ReceiptSerializationException("'" + path + "' must be an object");
        }
        return new BoundingBox(
            requireNumber(node.get("left"), path + ".left"),
            requireNumber(node.get("top"), path + ".top"),
            requireNumber(node.get("width"), path + ".width"),
            requireNumber(node.get("height"), path + ".height"));
    }

    private ReceiptFormatType readFormatType(JsonNode node) {
        if (node == null || !node.isTextual()) {
            throw new ReceiptSerializationException("'formatType' must be a string");
        }
        return ReceiptFormatType.fromValue(node.textValue())
            .orElseThrow(() -> new ReceiptSerializationException("Unknown formatType '" + node.textValue() + "'"));
    }

    private static int requireInt(JsonNode node, String path) {
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ReceiptSerializationException("'" + path + "' must be an integer");
        }
        return node.intValue();
    }

    private static double requireNumber(JsonNode node, String path) {
        if (node == null || !node.isNumber()) {
            throw new ReceiptSerializationException("'" + path + "' must be a number");
        }
        return node.doubleValue();
    }
}
