package dev.pekelund.shelfscan.scanner.config;

import dev.pekelund.shelfscan.scanner.catalog.CatalogProductRepository;
import dev.pekelund.shelfscan.scanner.ocr.OcrClient;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Emits diagnostic logging when the service boots so the deployed configuration and the resolved
 * collaborators can be verified.
 */
@Component
public class ReceiptScannerDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptScannerDiagnostics.class);

    private final Environment environment;
    private final ObjectProvider<OcrClient> ocrClientProvider;
    private final ObjectProvider<ChatModel> chatModelProvider;
    private final ObjectProvider<CatalogProductRepository> catalogProvider;
    private final ObjectProvider<ScannerSettings> settingsProvider;

    public ReceiptScannerDiagnostics(Environment environment, ObjectProvider<OcrClient> ocrClientProvider,
        ObjectProvider<ChatModel> chatModelProvider, ObjectProvider<CatalogProductRepository> catalogProvider,
        ObjectProvider<ScannerSettings> settingsProvider) {
        this.environment = environment;
        this.ocrClientProvider = ocrClientProvider;
        this.chatModelProvider = chatModelProvider;
        this.catalogProvider = catalogProvider;
        this.settingsProvider = settingsProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Receipt scanner diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Resolved Google AI Gemini configuration - model: {}",
            environment.getProperty("google.ai.gemini.model", "(unset)"));

        OcrClient ocrClient = ocrClientProvider.getIfAvailable();
        if (ocrClient != null) {
            LOGGER.info("OCR client implementation: {} (configured: {})", ocrClient.getClass().getName(),
                ocrClient.isConfigured());
        } else {
            LOGGER.info("OcrClient bean not available; skipping OCR diagnostics");
        }

        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel != null) {
            LOGGER.info("Chat model implementation: {} - default options: {}", chatModel.getClass().getName(),
                chatModel.getDefaultOptions());
        } else {
            LOGGER.info("ChatModel bean not available; skipping chat model diagnostics");
        }

        CatalogProductRepository catalog = catalogProvider.getIfAvailable();
        if (catalog != null) {
            LOGGER.info("Catalog repository implementation: {}", catalog.getClass().getName());
        }

        ScannerSettings settings = settingsProvider.getIfAvailable();
        if (settings != null) {
            LOGGER.info("AI fallback enabled: {}, confidence threshold: {}, max products: {}",
                settings.enableAiFallback(), settings.confidenceThreshold(), settings.maxProducts());
        }
    }
}
