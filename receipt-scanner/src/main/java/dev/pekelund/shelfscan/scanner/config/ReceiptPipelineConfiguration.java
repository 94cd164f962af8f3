package dev.pekelund.shelfscan.scanner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.shelfscan.receipts.extraction.ProductIdGenerator;
import dev.pekelund.shelfscan.receipts.extraction.ReceiptProductExtractor;
import dev.pekelund.shelfscan.receipts.extraction.RowExtractor;
import dev.pekelund.shelfscan.receipts.mapping.ColumnMapper;
import dev.pekelund.shelfscan.receipts.serialization.ParsedReceiptPrinter;
import dev.pekelund.shelfscan.receipts.serialization.ParsedReceiptSerializer;
import dev.pekelund.shelfscan.receipts.table.TableBuilder;
import dev.pekelund.shelfscan.scanner.ReceiptScannerService;
import dev.pekelund.shelfscan.scanner.ai.AiResponseParser;
import dev.pekelund.shelfscan.scanner.ai.NameOnlyListExtractor;
import dev.pekelund.shelfscan.scanner.catalog.CatalogEnricher;
import dev.pekelund.shelfscan.scanner.catalog.CatalogProductRepository;
import dev.pekelund.shelfscan.scanner.ocr.OcrBlockGraphFactory;
import dev.pekelund.shelfscan.scanner.ocr.OcrClient;
import dev.pekelund.shelfscan.scanner.policy.ConfidencePolicy;
import dev.pekelund.shelfscan.scanner.policy.ReceiptMetadataExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Extraction pipeline shared by every profile. The remote collaborators it needs ({@link OcrClient},
 * {@link ChatModel}, {@link ChatOptions} and {@link CatalogProductRepository}) come from the profile
 * specific configuration.
 */
@Configuration
public class ReceiptPipelineConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptPipelineConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    @Bean
    public ScannerSettings scannerSettings(ReceiptScannerProperties properties) {
        ScannerSettings settings = properties.toSettings();
        LOGGER.info("Receipt scanner settings: {}", settings);
        return settings;
    }

    @Bean
    public TableBuilder tableBuilder() {
        return new TableBuilder();
    }

    @Bean
    public ColumnMapper columnMapper() {
        return new ColumnMapper();
    }

    @Bean
    public ProductIdGenerator productIdGenerator() {
        return new ProductIdGenerator();
    }

    @Bean
    public ReceiptProductExtractor receiptProductExtractor(ScannerSettings settings,
        ProductIdGenerator productIdGenerator) {
        RowExtractor rowExtractor = new RowExtractor(settings.missingFieldConfidence(),
            settings.confidenceThreshold(), productIdGenerator);
        return new ReceiptProductExtractor(rowExtractor);
    }

    @Bean
    public OcrBlockGraphFactory ocrBlockGraphFactory() {
        return new OcrBlockGraphFactory();
    }

    @Bean
    public ReceiptMetadataExtractor receiptMetadataExtractor() {
        return new ReceiptMetadataExtractor();
    }

    @Bean
    public ConfidencePolicy confidencePolicy(ScannerSettings settings) {
        return new ConfidencePolicy(settings);
    }

    @Bean
    public NameOnlyListExtractor nameOnlyListExtractor(ChatModel chatModel, ChatOptions receiptChatOptions,
        ObjectMapper objectMapper) {
        return new NameOnlyListExtractor(chatModel, receiptChatOptions, new AiResponseParser(objectMapper));
    }

    @Bean
    public ReceiptScannerService receiptScannerService(OcrClient ocrClient, OcrBlockGraphFactory ocrBlockGraphFactory,
        TableBuilder tableBuilder, ColumnMapper columnMapper, ReceiptProductExtractor receiptProductExtractor,
        ReceiptMetadataExtractor receiptMetadataExtractor, NameOnlyListExtractor nameOnlyListExtractor,
        ConfidencePolicy confidencePolicy, ProductIdGenerator productIdGenerator, ScannerSettings settings) {
        return new ReceiptScannerService(ocrClient, ocrBlockGraphFactory, tableBuilder, columnMapper,
            receiptProductExtractor, receiptMetadataExtractor, nameOnlyListExtractor, confidencePolicy,
            productIdGenerator, settings);
    }

    @Bean
    public CatalogEnricher catalogEnricher(CatalogProductRepository catalogProductRepository,
        ScannerSettings settings) {
        return new CatalogEnricher(catalogProductRepository, settings.catalogMatchThreshold());
    }

    @Bean
    public ParsedReceiptSerializer parsedReceiptSerializer(ObjectMapper objectMapper) {
        return new ParsedReceiptSerializer(objectMapper);
    }

    @Bean
    public ParsedReceiptPrinter parsedReceiptPrinter() {
        return new ParsedReceiptPrinter();
    }
}
