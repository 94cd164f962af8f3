package dev.pekelund.shelfscan.receipts.table;

import dev.pekelund.shelfscan.receipts.model.CellData;
import dev.pekelund.shelfscan.receipts.model.ParsedReceipt;
import dev.pekelund.shelfscan.receipts.model.ParsedRow;
import dev.pekelund.shelfscan.receipts.model.ReceiptFormatType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Turns an OCR block graph into a {@link ParsedReceipt}.
 *
 * <p>When the graph contains a table, the first table is used and its lowest row becomes the header.
 * Without a table the text lines are split on tabs and runs of whitespace and the first line with at
 * least three parts is taken as the header. Building never fails: the worst outcome is an empty
 * receipt of unknown format.</p>
 */
public class TableBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableBuilder.class);

    private static final Pattern LINE_SEPARATOR = Pattern.compile("\\t|\\s{2,}");
    private static final int MIN_LINE_HEADER_PARTS = 3;
    private static final int MIN_LINE_ROW_PARTS = 2;
    private static final int MIN_SIMPLE_LIST_HEADERS = 3;

    private static final List<String> TAX_INVOICE_KEYWORDS = List.of("hsn", "cgst", "sgst");
    private static final List<String> DISTRIBUTOR_KEYWORDS = List.of("distributor", "dealer");

    public ParsedReceipt build(List<OcrBlock> blocks) {
        if (blocks == null || blocks.isEmpty()) {
            LOGGER.debug("No OCR blocks supplied; returning empty receipt");
            return ParsedReceipt.empty();
        }

        Map<String, OcrBlock> blocksById = new LinkedHashMap<>();
        for (OcrBlock block : blocks) {
            if (block != null && block.id() != null) {
                blocksById.putIfAbsent(block.id(), block);
            }
        }

        Optional<OcrBlock> table = blocks.stream()
            .filter(Objects::nonNull)
            .filter(block -> block.type() == BlockType.TABLE)
            .findFirst();

        if (table.isEmpty()) {
            LOGGER.info("OCR result contains no table; parsing text lines instead");
            return buildFromLines(blocks);
        }
        return buildFromTable(table.get(), blocksById);
    }

    private ParsedReceipt buildFromTable(OcrBlock table, Map<String, OcrBlock> blocksById) {
        Map<Integer, List<OcrBlock>> cellsByRow = new TreeMap<>();
        for (String childId : table.childIds()) {
            OcrBlock child = blocksById.get(childId);
            if (child == null || child.type() != BlockType.CELL) {
                continue;
            }
            int rowIndex = child.rowIndex() != null ? child.rowIndex() : 0;
            cellsByRow.computeIfAbsent(rowIndex, key -> new ArrayList<>()).add(child);
        }

        if (cellsByRow.isEmpty()) {
            LOGGER.info("Table '{}' has no cells", table.id());
            return ParsedReceipt.empty();
        }

        List<List<OcrBlock>> orderedRows = cellsByRow.values().stream()
            .map(TableBuilder::sortByColumn)
            .collect(Collectors.toList());

        List<String> headers = orderedRows.get(0).stream()
            .map(cell -> cellText(cell, blocksById))
            .collect(Collectors.toList());

        List<ParsedRow> rows = new ArrayList<>();
        for (int i = 1; i < orderedRows.size(); i++) {
            int dataRowIndex = i - 1;
            List<CellData> cells = orderedRows.get(i).stream()
                .map(cell -> toCellData(cell, dataRowIndex, blocksById))
                .collect(Collectors.toList());
            String rawText = cells.stream()
                .map(CellData::text)
                .collect(Collectors.joining(ParsedRow.CELL_DELIMITER));
            rows.add(new ParsedRow(cells, rawText));
        }

        ReceiptFormatType formatType = detectFormatType(headers);
        LOGGER.info("Parsed table '{}' with {} headers and {} data rows (format {})", table.id(), headers.size(),
            rows.size(), formatType);
        return new ParsedReceipt(headers, rows, formatType);
    }

    private static List<OcrBlock> sortByColumn(List<OcrBlock> cells) {
        List<OcrBlock> sorted = new ArrayList<>(cells);
        sorted.sort(Comparator.comparingInt(cell -> cell.columnIndex() != null ? cell.columnIndex() : 1));
        return sorted;
    }

    private static CellData toCellData(OcrBlock cell, int dataRowIndex, Map<String, OcrBlock> blocksById) {
        int columnIndex = (cell.columnIndex() != null ? cell.columnIndex() : 1) - 1;
        return new CellData(cellText(cell, blocksById), columnIndex, dataRowIndex, fraction(cell.confidence()),
            cell.geometry());
    }

    private static String cellText(OcrBlock cell, Map<String, OcrBlock> blocksById) {
        if (StringUtils.hasLength(cell.text())) {
            return cell.text();
        }
        return cell.childIds().stream()
            .map(blocksById::get)
            .filter(Objects::nonNull)
            .filter(child -> child.type() == BlockType.WORD)
            .map(OcrBlock::text)
            .filter(StringUtils::hasLength)
            .collect(Collectors.joining(" "));
    }

    private ParsedReceipt buildFromLines(List<OcrBlock> blocks) {
        List<OcrBlock> lines = blocks.stream()
            .filter(Objects::nonNull)
            .filter(block -> block.type() == BlockType.LINE)
            .filter(block -> StringUtils.hasText(block.text()))
            .sorted(Comparator.comparingDouble(TableBuilder::top))
            .collect(Collectors.toList());

        List<String> headers = List.of();
        List<ParsedRow> rows = new ArrayList<>();
        boolean headerFound = false;

        for (OcrBlock line : lines) {
            List<String> parts = splitLine(line.text());
            if (!headerFound && parts.size() >= MIN_LINE_HEADER_PARTS) {
                headers = parts;
                headerFound = true;
            } else if (headerFound && parts.size() >= MIN_LINE_ROW_PARTS) {
                int rowIndex = rows.size();
                double confidence = fraction(line.confidence());
                List<CellData> cells = new ArrayList<>();
                for (int column = 0; column < parts.size(); column++) {
                    cells.add(new CellData(parts.get(column), column, rowIndex, confidence));
                }
                rows.add(new ParsedRow(cells, line.text()));
            }
        }

        ReceiptFormatType formatType = headerFound ? ReceiptFormatType.SIMPLE_LIST : ReceiptFormatType.UNKNOWN;
        LOGGER.info("Line based parsing of {} lines produced {} headers and {} rows", lines.size(), headers.size(),
            rows.size());
        return new ParsedReceipt(headers, rows, formatType);
    }

    static List<String> splitLine(String text) {
        return Arrays.stream(LINE_SEPARATOR.split(text.trim()))
            .map(String::trim)
            .filter(part -> !part.isEmpty())
            .collect(Collectors.toList());
    }

    private static double top(OcrBlock block) {
        return block.geometry() != null ? block.geometry().top() : 0.0;
    }

    private static double fraction(Double percentage) {
        return percentage != null ? percentage / 100.0 : 0.0;
    }

    /**
     * Classifies a layout from its header vocabulary: tax keywords win over distributor keywords,
     * and three or more unrecognised headers make a simple list.
     */
    public static ReceiptFormatType detectFormatType(List<String> headers) {
        if (headers == null || headers.isEmpty()) {
            return ReceiptFormatType.UNKNOWN;
        }
        String vocabulary = headers.stream()
            .filter(Objects::nonNull)
            .map(header -> header.toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(" "));
        if (TAX_INVOICE_KEYWORDS.stream().anyMatch(vocabulary::contains)) {
            return ReceiptFormatType.TAX_INVOICE;
        }
        if (DISTRIBUTOR_KEYWORDS.stream().anyMatch(vocabulary::contains)) {
            return ReceiptFormatType.DISTRIBUTOR_BILL;
        }
        if (headers.size() >= MIN_SIMPLE_LIST_HEADERS) {
            return ReceiptFormatType.SIMPLE_LIST;
        }
        return ReceiptFormatType.UNKNOWN;
    }
}
