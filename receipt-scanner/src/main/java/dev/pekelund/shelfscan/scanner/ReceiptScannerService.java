package dev.pekelund.shelfscan.scanner;

import dev.pekelund.shelfscan.receipts.extraction.ProductIdGenerator;
import dev.pekelund.shelfscan.receipts.extraction.ReceiptProductExtractor;
import dev.pekelund.shelfscan.receipts.mapping.ColumnMapper;
import dev.pekelund.shelfscan.receipts.mapping.MapColumnsResult;
import dev.pekelund.shelfscan.receipts.model.ExtractedReceiptProduct;
import dev.pekelund.shelfscan.receipts.model.FieldConfidences;
import dev.pekelund.shelfscan.receipts.model.MappingDecision;
import dev.pekelund.shelfscan.receipts.model.ParsedReceipt;
import dev.pekelund.shelfscan.receipts.model.ReceiptFormatType;
import dev.pekelund.shelfscan.receipts.model.ReceiptMetadata;
import dev.pekelund.shelfscan.receipts.model.ScanResult;
import dev.pekelund.shelfscan.receipts.table.OcrBlock;
import dev.pekelund.shelfscan.receipts.table.TableBuilder;
import dev.pekelund.shelfscan.scanner.ai.FallbackTier;
import dev.pekelund.shelfscan.scanner.ai.NameOnlyExtraction;
import dev.pekelund.shelfscan.scanner.ai.NameOnlyListExtractor;
import dev.pekelund.shelfscan.scanner.config.ScannerSettings;
import dev.pekelund.shelfscan.scanner.ocr.OcrAnalysis;
import dev.pekelund.shelfscan.scanner.ocr.OcrBlockGraphFactory;
import dev.pekelund.shelfscan.scanner.ocr.OcrClient;
import dev.pekelund.shelfscan.scanner.ocr.OcrConfigurationException;
import dev.pekelund.shelfscan.scanner.policy.ConfidencePolicy;
import dev.pekelund.shelfscan.scanner.policy.ReceiptMetadataExtractor;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans one receipt image into structured products.
 *
 * <p>The structured path runs OCR, builds a table, maps its columns and extracts one product per row.
 * When any of these stages cannot produce a result, and the AI fallback is enabled, the OCR lines are
 * handed to the {@link NameOnlyListExtractor} instead. Both paths end in the {@link ConfidencePolicy}.
 * {@link #scan(byte[])} never throws; every failure is reported through {@link ScanResult#error()}.</p>
 */
public class ReceiptScannerService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptScannerService.class);

    static final String NO_IMAGE_ERROR = "No image data provided.";
    static final String NO_TEXT_ERROR =
        "No text detected in the image. Please ensure the image is clear and contains readable text.";
    static final String NO_STRUCTURE_ERROR =
        "Could not identify table structure. Please ensure the receipt has clear column headers.";
    static final String OCR_NOT_CONFIGURED_ERROR =
        "OCR service is not configured. Please check the Document AI settings.";
    static final String NO_PRODUCTS_ERROR = "No products could be extracted from the image.";
    static final String PROCESSING_ERROR_PREFIX = "Processing error: ";

    static final String FALLBACK_HEADER = "AI Fallback";
    static final double NAME_ONLY_QUANTITY_CONFIDENCE = 0.5;
    static final double NAME_ONLY_AMOUNT_CONFIDENCE = 0.1;

    private final OcrClient ocrClient;
    private final OcrBlockGraphFactory blockGraphFactory;
    private final TableBuilder tableBuilder;
    private final ColumnMapper columnMapper;
    private final ReceiptProductExtractor productExtractor;
    private final ReceiptMetadataExtractor metadataExtractor;
    private final NameOnlyListExtractor nameOnlyListExtractor;
    private final ConfidencePolicy confidencePolicy;
    private final ProductIdGenerator idGenerator;
    private final ScannerSettings settings;

    public ReceiptScannerService(OcrClient ocrClient, OcrBlockGraphFactory blockGraphFactory,
        TableBuilder tableBuilder, ColumnMapper columnMapper, ReceiptProductExtractor productExtractor,
        ReceiptMetadataExtractor metadataExtractor, NameOnlyListExtractor nameOnlyListExtractor,
        ConfidencePolicy confidencePolicy, ProductIdGenerator idGenerator, ScannerSettings settings) {
        this.ocrClient = ocrClient;
        this.blockGraphFactory = blockGraphFactory;
        this.tableBuilder = tableBuilder;
        this.columnMapper = columnMapper;
        this.productExtractor = productExtractor;
        this.metadataExtractor = metadataExtractor;
        this.nameOnlyListExtractor = nameOnlyListExtractor;
        this.confidencePolicy = confidencePolicy;
        this.idGenerator = idGenerator;
        this.settings = settings;
    }

    public ScanResult scan(byte[] image) {
        String scanId = UUID.randomUUID().toString();
        try (ReceiptScanMdc.Context ignored = ReceiptScanMdc.open(scanId)) {
            LOGGER.info("Starting receipt scan of {} bytes", image != null ? image.length : 0);
            if (image == null || image.length == 0) {
                return ScanResult.failure(NO_IMAGE_ERROR, ReceiptMetadata.unknown(), List.of());
            }
            ScanResult result;
            try {
                result = resolve(runStructuredPath(image), image);
            } catch (RuntimeException ex) {
                LOGGER.error("Receipt scan failed unexpectedly", ex);
                result = ScanResult.failure(PROCESSING_ERROR_PREFIX + ex.getMessage(), ReceiptMetadata.unknown(),
                    List.of());
            }
            ReceiptScanMdc.setStage(ScanStage.DONE);
            LOGGER.info("Receipt scan finished (success: {}, products: {}, confidence: {})", result.success(),
                result.products().size(), result.confidence());
            return result;
        }
    }

    private ScanResult resolve(ScanAttempt attempt, byte[] image) {
        if (attempt.isCompleted()) {
            return attempt.result();
        }
        if (attempt.fallbackPermitted() && settings.enableAiFallback()) {
            LOGGER.warn("Structured extraction gave up ({}); trying the name-only fallback", attempt.error());
            return runFallback(attempt, image);
        }
        LOGGER.info("Scan failed without fallback: {}", attempt.error());
        return ScanResult.failure(attempt.error(), attempt.metadata(), attempt.mappingLog());
    }

    private ScanAttempt runStructuredPath(byte[] image) {
        ReceiptScanMdc.setStage(ScanStage.OCR);
        OcrAnalysis analysis;
        try {
            analysis = ocrClient.analyze(image);
        } catch (OcrConfigurationException ex) {
            LOGGER.warn("OCR is not configured: {}", ex.getMessage());
            if (nameOnlyListExtractor.isModelConfigured()) {
                return ScanAttempt.needsFallback(OCR_NOT_CONFIGURED_ERROR, List.of(), List.of(),
                    ReceiptMetadata.unknown());
            }
            return ScanAttempt.terminal(OCR_NOT_CONFIGURED_ERROR, List.of(), ReceiptMetadata.unknown());
        } catch (RuntimeException ex) {
            LOGGER.error("OCR analysis failed", ex);
            return ScanAttempt.needsFallback(PROCESSING_ERROR_PREFIX + ex.getMessage(), List.of(), List.of(),
                ReceiptMetadata.unknown());
        }

        if (analysis == null || analysis.isEmpty()) {
            LOGGER.info("OCR returned no text");
            return ScanAttempt.needsFallback(NO_TEXT_ERROR, List.of(), List.of(), ReceiptMetadata.unknown());
        }
        LOGGER.info("OCR returned {} lines and {} tables", analysis.textLines().size(), analysis.tables().size());

        List<String> lines = analysis.textLines();
        try {
            return parseStructure(analysis);
        } catch (RuntimeException ex) {
            LOGGER.error("Structured extraction failed", ex);
            return ScanAttempt.needsFallback(PROCESSING_ERROR_PREFIX + ex.getMessage(), lines, List.of(),
                metadataExtractor.extract(lines, ReceiptFormatType.UNKNOWN));
        }
    }

    private ScanAttempt parseStructure(OcrAnalysis analysis) {
        List<String> lines = analysis.textLines();

        ReceiptScanMdc.setStage(ScanStage.STRUCTURE_PARSE);
        List<OcrBlock> blocks = blockGraphFactory.toBlocks(analysis);
        ParsedReceipt receipt = tableBuilder.build(blocks);
        ReceiptMetadata metadata = metadataExtractor.extract(lines, receipt.formatType());
        if (!receipt.hasHeaders()) {
            LOGGER.info("No table structure found in {} blocks", blocks.size());
            return ScanAttempt.needsFallback(NO_STRUCTURE_ERROR, lines, List.of(), metadata);
        }

        ReceiptScanMdc.setStage(ScanStage.COLUMN_MAP);
        MapColumnsResult mapping = columnMapper.mapColumns(receipt.headers());
        if (!mapping.success()) {
            LOGGER.info("Columns {} could not be mapped", receipt.headers());
            return ScanAttempt.needsFallback(NO_STRUCTURE_ERROR, lines, mapping.decisions(), metadata);
        }

        ReceiptScanMdc.setStage(ScanStage.ROW_EXTRACT);
        List<ExtractedReceiptProduct> products = productExtractor.extractProducts(receipt, mapping.mapping());
        LOGGER.info("Extracted {} products from {} rows", products.size(), receipt.rows().size());

        ReceiptScanMdc.setStage(ScanStage.POSTPROCESS);
        List<ExtractedReceiptProduct> processed = confidencePolicy.apply(products, receipt.formatType(), false);
        return ScanAttempt.completed(ScanResult.success(processed, metadata,
            ConfidencePolicy.aggregateConfidence(processed), mapping.decisions()));
    }

    private ScanResult runFallback(ScanAttempt attempt, byte[] image) {
        ReceiptScanMdc.setStage(ScanStage.AI_FALLBACK);
        NameOnlyExtraction extraction = nameOnlyListExtractor.extract(attempt.lines(), image);
        ReceiptMetadata metadata = asUnknownFormat(attempt.metadata());
        List<MappingDecision> mappingLog = new ArrayList<>(attempt.mappingLog());

        if (!extraction.success()) {
            String error = extraction.error() != null ? extraction.error() : NO_PRODUCTS_ERROR;
            LOGGER.warn("Name-only fallback failed: {}", error);
            mappingLog.add(new MappingDecision(FALLBACK_HEADER, extraction.error() != null ? "error" : "none", 0.0,
                error));
            return ScanResult.failure(error, metadata, mappingLog);
        }

        FallbackTier tier = extraction.tier();
        double overall = tier == FallbackTier.AI_CLEANED
            ? settings.aiFallbackConfidence()
            : settings.rawLineFallbackConfidence();
        List<ExtractedReceiptProduct> products = new ArrayList<>(extraction.names().size());
        for (String name : extraction.names()) {
            products.add(nameOnlyProduct(name, overall, tier));
        }

        ReceiptScanMdc.setStage(ScanStage.POSTPROCESS);
        List<ExtractedReceiptProduct> processed = confidencePolicy.apply(products, ReceiptFormatType.UNKNOWN, true);
        double confidence = ConfidencePolicy.aggregateConfidence(processed);
        String reason = extraction.note() != null
            ? extraction.note()
            : "Extracted " + processed.size() + " product names with the generative model";
        mappingLog.add(new MappingDecision(FALLBACK_HEADER, tier.mappingField(), confidence, reason));
        LOGGER.info("Name-only fallback produced {} products ({})", processed.size(), tier.mappingField());
        return ScanResult.success(processed, metadata, confidence, mappingLog);
    }

    private ExtractedReceiptProduct nameOnlyProduct(String name, double overall, FallbackTier tier) {
        double nameConfidence = Math.min(tier.nameConfidence(), settings.unknownFormatMaxConfidence());
        FieldConfidences fieldConfidences = new FieldConfidences(nameConfidence,
            NAME_ONLY_QUANTITY_CONFIDENCE, NAME_ONLY_AMOUNT_CONFIDENCE);
        return new ExtractedReceiptProduct(idGenerator.nextId(), name, name, name, 1.0, 0.0, 0.0, null, null,
            overall, true, fieldConfidences, null, null, null);
    }

    private static ReceiptMetadata asUnknownFormat(ReceiptMetadata metadata) {
        if (metadata == null) {
            return ReceiptMetadata.unknown();
        }
        return new ReceiptMetadata(ReceiptFormatType.UNKNOWN, metadata.merchantName(), metadata.invoiceNumber(),
            metadata.date(), metadata.totalAmount());
    }
}
