package dev.pekelund.shelfscan.scanner.config;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.documentai.v1.DocumentProcessorServiceClient;
import com.google.cloud.documentai.v1.DocumentProcessorServiceSettings;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import dev.pekelund.shelfscan.scanner.ai.UnconfiguredChatModel;
import dev.pekelund.shelfscan.scanner.ai.googleai.GoogleAiGeminiChatModel;
import dev.pekelund.shelfscan.scanner.catalog.CatalogProductRepository;
import dev.pekelund.shelfscan.scanner.catalog.EmptyCatalogProductRepository;
import dev.pekelund.shelfscan.scanner.catalog.FirestoreCatalogProductRepository;
import dev.pekelund.shelfscan.scanner.ocr.DisabledOcrClient;
import dev.pekelund.shelfscan.scanner.ocr.DocumentAiDocumentMapper;
import dev.pekelund.shelfscan.scanner.ocr.DocumentAiOcrClient;
import dev.pekelund.shelfscan.scanner.ocr.OcrClient;
import io.micrometer.observation.ObservationRegistry;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Remote collaborators of the scanner: Document AI for OCR, Google AI Studio Gemini for the name-only
 * fallback and Firestore for the product catalog. Each one degrades to a local stand-in when it is
 * disabled or not configured.
 */
@Configuration
@Profile("!local-scan-test")
public class ReceiptScannerConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptScannerConfiguration.class);

    private final ResourceLoader resourceLoader;

    public ReceiptScannerConfiguration(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    @Bean
    public ChatOptions receiptChatOptions(Environment environment) {
        String modelName = environment.getProperty("google.ai.gemini.model", "gemini-2.0-flash");
        Double temperature = environment.getProperty("google.ai.gemini.temperature", Double.class);
        Double topP = environment.getProperty("google.ai.gemini.top-p", Double.class);
        Integer topK = environment.getProperty("google.ai.gemini.top-k", Integer.class);
        Integer maxOutputTokens = environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class);
        LOGGER.info("Configured Google AI Gemini chat settings - model: {}, temperature: {}, topP: {}, topK: {}, maxOutputTokens: {}",
            modelName, temperature, topP, topK, maxOutputTokens);
        return ChatOptions.builder()
            .model(modelName)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxTokens(maxOutputTokens)
            .build();
    }

    @Bean
    public ChatModel chatModel(Environment environment, ChatOptions receiptChatOptions,
        ObjectProvider<ObservationRegistry> observationRegistry) {

        String apiKey = environment.getProperty("AI_STUDIO_API_KEY");
        if (!StringUtils.hasText(apiKey)) {
            LOGGER.warn("AI_STUDIO_API_KEY is not set; the name-only fallback will use raw OCR lines");
            return new UnconfiguredChatModel("Google AI Studio API key must be configured (AI_STUDIO_API_KEY)");
        }

        ObservationRegistry resolvedObservationRegistry = observationRegistry
            .getIfAvailable(() -> ObservationRegistry.NOOP);
        String baseUrl = environment.getProperty("google.ai.gemini.base-url",
            GoogleAiGeminiChatModel.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();

        GoogleAiGeminiChatModel chatModel = new GoogleAiGeminiChatModel(restClient, apiKey, receiptChatOptions,
            resolvedObservationRegistry);
        LOGGER.info("Google AI Gemini ChatModel default options: {}", chatModel.getDefaultOptions());
        return chatModel;
    }

    @Bean
    public OcrClient ocrClient(DocumentAiProperties properties) throws IOException {
        if (!properties.isEnabled()) {
            LOGGER.info("Document AI is disabled; OCR requests will fail with a configuration error");
            return new DisabledOcrClient("Document AI is disabled (documentai.enabled=false)");
        }
        if (!properties.isComplete()) {
            LOGGER.warn("Document AI is enabled but project id, location or processor id is missing");
            return new DisabledOcrClient("Document AI project id, location and processor id must be configured");
        }

        DocumentProcessorServiceSettings.Builder settingsBuilder = DocumentProcessorServiceSettings.newBuilder()
            .setEndpoint(properties.endpoint());
        GoogleCredentials credentials = loadCredentials(properties.getCredentials());
        if (credentials != null) {
            settingsBuilder.setCredentialsProvider(FixedCredentialsProvider.create(credentials));
        }
        DocumentProcessorServiceClient client = DocumentProcessorServiceClient.create(settingsBuilder.build());
        LOGGER.info("Initialized Document AI client for processor {}", properties.processorName());
        return new DocumentAiOcrClient(client, properties.processorName(), new DocumentAiDocumentMapper());
    }

    @Bean
    public CatalogProductRepository catalogProductRepository(CatalogProperties properties) {
        if (!properties.isEnabled()) {
            LOGGER.info("Product catalog is disabled; catalog matching finds no products");
            return new EmptyCatalogProductRepository();
        }
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder();
        if (StringUtils.hasText(properties.getProjectId())) {
            optionsBuilder.setProjectId(properties.getProjectId());
        }
        Firestore firestore = optionsBuilder.build().getService();
        LOGGER.info("Initialized Firestore client for project '{}' (catalog collection '{}')",
            firestore.getOptions().getProjectId(), properties.getCollection());
        return new FirestoreCatalogProductRepository(firestore, properties.getCollection());
    }

    private GoogleCredentials loadCredentials(String location) throws IOException {
        if (!StringUtils.hasText(location)) {
            return null;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            LOGGER.warn("Document AI credentials resource {} not found; falling back to application default credentials.",
                location);
            return null;
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return GoogleCredentials.fromStream(inputStream)
                .createScoped("https://www.googleapis.com/auth/cloud-platform");
        }
    }
}
