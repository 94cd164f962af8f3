package dev.pekelund.shelfscan.scanner.local;

import dev.pekelund.shelfscan.scanner.ai.UnconfiguredChatModel;
import dev.pekelund.shelfscan.scanner.catalog.CatalogProductRepository;
import dev.pekelund.shelfscan.scanner.catalog.EmptyCatalogProductRepository;
import dev.pekelund.shelfscan.scanner.ocr.DisabledOcrClient;
import dev.pekelund.shelfscan.scanner.ocr.OcrClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("local-scan-test")
public class LocalScanTestConfiguration {

    @Bean
    public ChatOptions receiptChatOptions() {
        return ChatOptions.builder().model("local").build();
    }

    @Bean
    public ChatModel chatModel() {
        return new UnconfiguredChatModel("Generative model is not available in the local-scan-test profile");
    }

    @Bean
    public OcrClient ocrClient() {
        return new DisabledOcrClient("OCR is not available in the local-scan-test profile");
    }

    @Bean
    public CatalogProductRepository catalogProductRepository() {
        return new EmptyCatalogProductRepository();
    }
}
