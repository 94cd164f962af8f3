package dev.pekelund.shelfscan.scanner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.pekelund.shelfscan.receipts.extraction.ProductIdGenerator;
import dev.pekelund.shelfscan.receipts.extraction.ReceiptProductExtractor;
import dev.pekelund.shelfscan.receipts.extraction.RowExtractor;
import dev.pekelund.shelfscan.receipts.mapping.ColumnMapper;
import dev.pekelund.shelfscan.receipts.model.ExtractedReceiptProduct;
import dev.pekelund.shelfscan.receipts.model.MappingDecision;
import dev.pekelund.shelfscan.receipts.model.ReceiptFormatType;
import dev.pekelund.shelfscan.receipts.model.ScanResult;
import dev.pekelund.shelfscan.receipts.table.TableBuilder;
import dev.pekelund.shelfscan.scanner.ai.AiResponseParser;
import dev.pekelund.shelfscan.scanner.ai.NameOnlyListExtractor;
import dev.pekelund.shelfscan.scanner.ai.UnconfiguredChatModel;
import dev.pekelund.shelfscan.scanner.config.ScannerSettings;
import dev.pekelund.shelfscan.scanner.ocr.OcrAnalysis;
import dev.pekelund.shelfscan.scanner.ocr.OcrBlockGraphFactory;
import dev.pekelund.shelfscan.scanner.ocr.OcrCell;
import dev.pekelund.shelfscan.scanner.ocr.OcrClient;
import dev.pekelund.shelfscan.scanner.ocr.OcrClientException;
import dev.pekelund.shelfscan.scanner.ocr.OcrConfigurationException;
import dev.pekelund.shelfscan.scanner.ocr.OcrTable;
import dev.pekelund.shelfscan.scanner.policy.ConfidencePolicy;
import dev.pekelund.shelfscan.scanner.policy.ReceiptMetadataExtractor;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

@ExtendWith(MockitoExtension.class)
class ReceiptScannerServiceTest {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10};

    @Mock
    private OcrClient ocrClient;

    @Mock
    private ChatModel chatModel;

    @Test
    void scansStructuredTableIntoProducts() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(
            List.of("ABC Traders", "Invoice No: INV-42", "Date: 12/03/2024", "Total: Rs. 100.00"),
            List.of(table(
                List.of("Item Description", "Qty", "Net Amt"),
                List.of("1234 Maggi Noodles", "5", "100"))),
            List.of()));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults()).scan(JPEG);

        assertThat(result.success()).isTrue();
        assertThat(result.error()).isNull();
        assertThat(result.products()).hasSize(1);
        ExtractedReceiptProduct product = result.products().get(0);
        assertThat(product.name()).isEqualTo("Maggi Noodles");
        assertThat(product.hsnCode()).isEqualTo("1234");
        assertThat(product.quantity()).isEqualTo(5.0);
        assertThat(product.netAmount()).isEqualTo(100.0);
        assertThat(product.unitPrice()).isEqualTo(20.0);
        assertThat(product.originalName()).isEqualTo("1234 Maggi Noodles");
        assertThat(product.confidence()).isCloseTo(0.95, within(1e-9));
        assertThat(product.needsReview()).isFalse();
        assertThat(result.confidence()).isCloseTo(0.95, within(1e-9));
        assertThat(result.mappingLog()).extracting(MappingDecision::assignedField)
            .containsExactly("productName", "quantity", "netAmount");
        assertThat(result.metadata().formatType()).isEqualTo(ReceiptFormatType.SIMPLE_LIST);
        assertThat(result.metadata().merchantName()).isEqualTo("ABC Traders");
        assertThat(result.metadata().invoiceNumber()).isEqualTo("INV-42");
        assertThat(result.metadata().date()).isEqualTo("12/03/2024");
        assertThat(result.metadata().totalAmount()).isEqualTo(100.0);
        verify(chatModel, never()).call(any(Prompt.class));
    }

    @Test
    void reportsTaxInvoiceFormatFromHeaders() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of("Sharma Distributors"),
            List.of(table(
                List.of("HSN", "Particulars", "Qty", "Taxable Value"),
                List.of("3402", "Surf Excel Detergent", "2", "240"))),
            List.of()));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults()).scan(JPEG);

        assertThat(result.success()).isTrue();
        assertThat(result.metadata().formatType()).isEqualTo(ReceiptFormatType.TAX_INVOICE);
        assertThat(result.products()).singleElement()
            .satisfies(product -> {
                assertThat(product.name()).isEqualTo("Surf Excel Detergent");
                assertThat(product.unitPrice()).isEqualTo(120.0);
            });
    }

    @Test
    void failsWhenRequiredColumnsAreMissingAndFallbackIsDisabled() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of("Description MRP"),
            List.of(table(List.of("Description", "MRP"), List.of("Maggi Noodles", "14"))), List.of()));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults().withAiFallback(false))
            .scan(JPEG);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo(ReceiptScannerService.NO_STRUCTURE_ERROR);
        assertThat(result.products()).isEmpty();
        assertThat(result.mappingLog()).extracting(MappingDecision::assignedField)
            .containsExactly("productName", "mrp");
    }

    @Test
    void fallsBackToModelWhenRequiredColumnsAreMissing() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of("Description MRP", "Maggi Noodles 14"),
            List.of(table(List.of("Description", "MRP"), List.of("Maggi Noodles", "14"))), List.of()));
        when(chatModel.call(any(Prompt.class))).thenReturn(response("[\"Maggi Noodles\", \"Amul Butter\"]"));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults()).scan(JPEG);

        assertThat(result.success()).isTrue();
        assertThat(result.products()).extracting(ExtractedReceiptProduct::name)
            .containsExactly("Maggi Noodles", "Amul Butter");
        assertThat(result.metadata().formatType()).isEqualTo(ReceiptFormatType.UNKNOWN);
        assertThat(result.mappingLog()).hasSize(3);
        MappingDecision fallback = result.mappingLog().get(2);
        assertThat(fallback.headerText()).isEqualTo("AI Fallback");
        assertThat(fallback.assignedField()).isEqualTo("ai_extraction");
        assertThat(fallback.confidence()).isCloseTo(0.35, within(1e-9));
        assertThat(result.confidence()).isCloseTo(0.35, within(1e-9));
    }

    @Test
    void nameOnlyProductsHaveZeroPriceUnitQuantityAndNeedReview() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of("Maggi", "Amul Butter", "Parle G"),
            List.of(), List.of()));
        when(chatModel.call(any(Prompt.class))).thenReturn(response("```json\n[\"Maggi\", \"Amul Butter\", \"Parle-G\"]\n```"));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults()).scan(JPEG);

        assertThat(result.success()).isTrue();
        assertThat(result.products()).hasSize(3).allSatisfy(product -> {
            assertThat(product.unitPrice()).isEqualTo(0.0);
            assertThat(product.netAmount()).isEqualTo(0.0);
            assertThat(product.quantity()).isEqualTo(1.0);
            assertThat(product.needsReview()).isTrue();
            assertThat(product.confidence()).isLessThanOrEqualTo(0.5);
            assertThat(product.fieldConfidences().name()).isEqualTo(0.5);
            assertThat(product.fieldConfidences().quantity()).isEqualTo(0.5);
            assertThat(product.fieldConfidences().netAmount()).isEqualTo(0.1);
            assertThat(product.originalText()).isEqualTo(product.name());
        });
        assertThat(result.products().get(2).name()).isEqualTo("Parle-G");
    }

    @Test
    void nameOnlyFieldConfidenceStaysWithinUnknownFormatCap() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of("Maggi", "Amul Butter"), List.of(),
            List.of()));
        when(chatModel.call(any(Prompt.class))).thenReturn(response("[\"Maggi\", \"Amul Butter\"]"));
        ScannerSettings relaxedCap = new ScannerSettings(0.7, true, 100, 0.9, 0.5, 0.35, 0.3,
            ScannerSettings.DEFAULT_MAX_IMAGE_BYTES, 0.8);
        ScannerSettings strictCap = new ScannerSettings(0.7, true, 100, 0.4, 0.5, 0.35, 0.3,
            ScannerSettings.DEFAULT_MAX_IMAGE_BYTES, 0.8);

        ScanResult relaxed = service(ocrClient, chatModel, relaxedCap).scan(JPEG);
        ScanResult strict = service(ocrClient, chatModel, strictCap).scan(JPEG);

        assertThat(relaxed.products()).extracting(product -> product.fieldConfidences().name())
            .containsOnly(0.85);
        assertThat(strict.products()).extracting(product -> product.fieldConfidences().name())
            .containsOnly(0.4);
        assertThat(strict.products()).allSatisfy(product ->
            assertThat(product.confidence()).isLessThanOrEqualTo(0.4));
    }

    @Test
    void unstructuredLinesFailWithoutFallback() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of("Maggi", "Amul Butter"), List.of(),
            List.of()));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults().withAiFallback(false))
            .scan(JPEG);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo(ReceiptScannerService.NO_STRUCTURE_ERROR);
        assertThat(result.metadata().formatType()).isEqualTo(ReceiptFormatType.UNKNOWN);
    }

    @Test
    void usesRawLinesWhenModelIsNotConfigured() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of("Maggi", "Amul Butter", "12/03/2024", "x"),
            List.of(), List.of()));

        ScanResult result = service(ocrClient, new UnconfiguredChatModel("no key"), ScannerSettings.defaults())
            .scan(JPEG);

        assertThat(result.success()).isTrue();
        assertThat(result.products()).extracting(ExtractedReceiptProduct::name)
            .containsExactly("Maggi", "Amul Butter");
        assertThat(result.products()).allSatisfy(product -> {
            assertThat(product.confidence()).isCloseTo(0.3, within(1e-9));
            assertThat(product.needsReview()).isTrue();
            assertThat(product.fieldConfidences().name()).isEqualTo(0.5);
        });
        MappingDecision fallback = result.mappingLog().get(result.mappingLog().size() - 1);
        assertThat(fallback.assignedField()).isEqualTo("raw_lines");
        assertThat(fallback.reason()).contains("not configured");
    }

    @Test
    void degradesToRawLinesWhenModelFails() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of("Maggi", "Amul Butter"), List.of(),
            List.of()));
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("quota exceeded"));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults()).scan(JPEG);

        assertThat(result.success()).isTrue();
        assertThat(result.products()).extracting(ExtractedReceiptProduct::name)
            .containsExactly("Maggi", "Amul Butter");
        MappingDecision fallback = result.mappingLog().get(result.mappingLog().size() - 1);
        assertThat(fallback.assignedField()).isEqualTo("raw_lines");
        assertThat(fallback.reason()).contains("quota exceeded");
    }

    @Test
    void reportsConfigurationErrorWhenOcrAndModelAreUnavailable() {
        when(ocrClient.analyze(any())).thenThrow(new OcrConfigurationException("processor missing"));

        ScanResult result = service(ocrClient, new UnconfiguredChatModel("no key"), ScannerSettings.defaults())
            .scan(JPEG);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo(ReceiptScannerService.OCR_NOT_CONFIGURED_ERROR);
    }

    @Test
    void readsImageWithModelWhenOcrIsNotConfigured() {
        when(ocrClient.analyze(any())).thenThrow(new OcrConfigurationException("processor missing"));
        when(chatModel.call(any(Prompt.class))).thenReturn(response(
            "{\"imageType\": \"name_only_list\", \"products\": [{\"name\": \"Parle G\", \"price\": 0}]}"));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults()).scan(JPEG);

        assertThat(result.success()).isTrue();
        assertThat(result.products()).extracting(ExtractedReceiptProduct::name).containsExactly("Parle G");
        assertThat(result.products().get(0).needsReview()).isTrue();
    }

    @Test
    void reportsConfigurationErrorWhenFallbackIsDisabled() {
        when(ocrClient.analyze(any())).thenThrow(new OcrConfigurationException("processor missing"));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults().withAiFallback(false))
            .scan(JPEG);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo(ReceiptScannerService.OCR_NOT_CONFIGURED_ERROR);
        verify(chatModel, never()).call(any(Prompt.class));
    }

    @Test
    void surfacesProcessingErrorWhenOcrFailsWithoutFallback() {
        when(ocrClient.analyze(any())).thenThrow(new OcrClientException("deadline exceeded"));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults().withAiFallback(false))
            .scan(JPEG);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Processing error: deadline exceeded");
    }

    @Test
    void reportsNoTextWhenFallbackCannotReadTheImage() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of(), List.of(), List.of()));

        ScanResult result = service(ocrClient, new UnconfiguredChatModel("no key"), ScannerSettings.defaults())
            .scan(JPEG);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("No text detected in the image");
        MappingDecision fallback = result.mappingLog().get(result.mappingLog().size() - 1);
        assertThat(fallback.headerText()).isEqualTo("AI Fallback");
        assertThat(fallback.assignedField()).isEqualTo("error");
    }

    @Test
    void reportsNoTextWithoutFallback() {
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of(), List.of(), List.of()));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults().withAiFallback(false))
            .scan(JPEG);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo(ReceiptScannerService.NO_TEXT_ERROR);
    }

    @Test
    void truncatesProductsToConfiguredMaximum() {
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of("Item", "Qty", "Amount"));
        rows.add(List.of("Maggi Noodles", "5", "100"));
        rows.add(List.of("Amul Butter", "2", "110"));
        rows.add(List.of("Parle G", "10", "50"));
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of("Store"), List.of(table(rows)),
            List.of()));

        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults().withMaxProducts(2)).scan(JPEG);

        assertThat(result.products()).extracting(ExtractedReceiptProduct::name)
            .containsExactly("Maggi Noodles", "Amul Butter");
    }

    @Test
    void rejectsEmptyImageWithoutCallingOcr() {
        ScanResult result = service(ocrClient, chatModel, ScannerSettings.defaults()).scan(new byte[0]);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo(ReceiptScannerService.NO_IMAGE_ERROR);
        verify(ocrClient, never()).analyze(any());
    }

    @Test
    void restoresMdcAfterScan() {
        MDC.put("request.id", "abc");
        when(ocrClient.analyze(any())).thenReturn(new OcrAnalysis(List.of(), List.of(), List.of()));
        try {
            service(ocrClient, chatModel, ScannerSettings.defaults().withAiFallback(false)).scan(JPEG);

            assertThat(MDC.get("request.id")).isEqualTo("abc");
            assertThat(MDC.get("scan.id")).isNull();
            assertThat(MDC.get("scan.stage")).isNull();
        } finally {
            MDC.clear();
        }
    }

    private static ReceiptScannerService service(OcrClient ocrClient, ChatModel chatModel, ScannerSettings settings) {
        ProductIdGenerator idGenerator =
            new ProductIdGenerator(Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC));
        NameOnlyListExtractor nameOnlyListExtractor = new NameOnlyListExtractor(chatModel,
            ChatOptions.builder().model("gemini-test").build(), new AiResponseParser(new ObjectMapper()));
        return new ReceiptScannerService(ocrClient, new OcrBlockGraphFactory(), new TableBuilder(),
            new ColumnMapper(),
            new ReceiptProductExtractor(new RowExtractor(settings.missingFieldConfidence(),
                settings.confidenceThreshold(), idGenerator)),
            new ReceiptMetadataExtractor(), nameOnlyListExtractor, new ConfidencePolicy(settings), idGenerator,
            settings);
    }

    @SafeVarargs
    private static OcrTable table(List<String>... rows) {
        return table(Arrays.asList(rows));
    }

    private static OcrTable table(List<List<String>> rows) {
        List<OcrCell> cells = new ArrayList<>();
        for (int row = 0; row < rows.size(); row++) {
            for (int column = 0; column < rows.get(row).size(); column++) {
                cells.add(new OcrCell(rows.get(row).get(column), row + 1, column + 1, 95.0, null));
            }
        }
        return new OcrTable(cells, 95.0);
    }

    private static ChatResponse response(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }
}
