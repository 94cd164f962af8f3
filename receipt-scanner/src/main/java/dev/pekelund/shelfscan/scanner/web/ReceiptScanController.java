package dev.pekelund.shelfscan.scanner.web;

import dev.pekelund.shelfscan.receipts.model.ParsedReceipt;
import dev.pekelund.shelfscan.receipts.model.ScanResult;
import dev.pekelund.shelfscan.receipts.serialization.ParsedReceiptPrinter;
import dev.pekelund.shelfscan.receipts.serialization.ParsedReceiptSerializer;
import dev.pekelund.shelfscan.receipts.serialization.ReceiptSerializationException;
import dev.pekelund.shelfscan.scanner.ReceiptScannerService;
import dev.pekelund.shelfscan.scanner.catalog.CatalogEnricher;
import dev.pekelund.shelfscan.scanner.config.ScannerSettings;
import dev.pekelund.shelfscan.scanner.ocr.ReceiptImageType;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for scanning receipt images and for checking serialized parsed receipts.
 */
@RestController
@RequestMapping(path = "/api/receipts")
public class ReceiptScanController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptScanController.class);

    private final ReceiptScannerService scannerService;
    private final CatalogEnricher catalogEnricher;
    private final ParsedReceiptSerializer serializer;
    private final ParsedReceiptPrinter printer;
    private final ScannerSettings settings;

    public ReceiptScanController(ReceiptScannerService scannerService, CatalogEnricher catalogEnricher,
        ParsedReceiptSerializer serializer, ParsedReceiptPrinter printer, ScannerSettings settings) {
        this.scannerService = scannerService;
        this.catalogEnricher = catalogEnricher;
        this.serializer = serializer;
        this.printer = printer;
        this.settings = settings;
    }

    @PostMapping(path = "/scan", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ScanResult scan(@RequestPart("file") MultipartFile file,
        @RequestParam(name = "enrich", defaultValue = "false") boolean enrich) throws IOException {

        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "A non-empty image must be provided as the 'file' part");
        }
        if (file.getSize() > settings.maxImageBytes()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Image exceeds the maximum size of " + settings.maxImageBytes() + " bytes");
        }

        byte[] image = file.getBytes();
        Optional<ReceiptImageType> imageType = ReceiptImageType.detect(image);
        if (imageType.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Only JPEG, PNG and WebP images are supported");
        }

        LOGGER.info("Scanning uploaded {} image '{}' ({} bytes, enrich: {})", imageType.get(),
            file.getOriginalFilename(), image.length, enrich);
        ScanResult result = scannerService.scan(image);
        if (enrich && result.success()) {
            result = catalogEnricher.enrich(result);
        }
        return result;
    }

    @PostMapping(path = "/parsed/validate", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public String validateParsedReceipt(@RequestBody String body) {
        ParsedReceipt receipt = serializer.deserialize(body);
        LOGGER.info("Validated parsed receipt with {} headers and {} rows", receipt.headers().size(),
            receipt.rows().size());
        return serializer.serialize(receipt);
    }

    @PostMapping(path = "/parsed/pretty", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.TEXT_PLAIN_VALUE)
    public String prettyPrintParsedReceipt(@RequestBody String body) {
        return printer.prettyPrint(serializer.deserialize(body));
    }

    @ExceptionHandler(ReceiptSerializationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleSerializationException(ReceiptSerializationException exception) {
        LOGGER.warn("Rejected parsed receipt: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatusException(ResponseStatusException exception) {
        LOGGER.warn("Rejected receipt upload: {}", exception.getReason());
        String reason = exception.getReason() != null ? exception.getReason() : exception.getMessage();
        return ResponseEntity.status(exception.getStatusCode()).body(Map.of("error", reason));
    }
}
