package dev.pekelund.shelfscan.scanner;

import dev.pekelund.shelfscan.scanner.config.CatalogProperties;
import dev.pekelund.shelfscan.scanner.config.DocumentAiProperties;
import dev.pekelund.shelfscan.scanner.config.ReceiptScannerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Spring Boot application entry point for the receipt scanning service.
 */
@SpringBootApplication
@EnableConfigurationProperties({ReceiptScannerProperties.class, DocumentAiProperties.class, CatalogProperties.class})
public class ReceiptScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReceiptScannerApplication.class, args);
    }
}
