package dev.pekelund.shelfscan.scanner.ocr;

import com.google.api.gax.rpc.ApiException;
import com.google.cloud.documentai.v1.DocumentProcessorServiceClient;
import com.google.cloud.documentai.v1.ProcessRequest;
import com.google.cloud.documentai.v1.ProcessResponse;
import com.google.cloud.documentai.v1.RawDocument;
import com.google.protobuf.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link OcrClient} backed by a Google Document AI processor.
 */
public class DocumentAiOcrClient implements OcrClient, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentAiOcrClient.class);

    private final DocumentProcessorServiceClient client;
    private final String processorName;
    private final DocumentAiDocumentMapper mapper;

    public DocumentAiOcrClient(DocumentProcessorServiceClient client, String processorName,
        DocumentAiDocumentMapper mapper) {
        this.client = client;
        this.processorName = processorName;
        this.mapper = mapper;
    }

    @Override
    public OcrAnalysis analyze(byte[] image) {
        if (image == null || image.length == 0) {
            throw new OcrClientException("Cannot analyse an empty image");
        }
        String mimeType = ReceiptImageType.detect(image)
            .map(ReceiptImageType::mimeType)
            .orElse(ReceiptImageType.JPEG.mimeType());

        ProcessRequest request = ProcessRequest.newBuilder()
            .setName(processorName)
            .setRawDocument(RawDocument.newBuilder()
                .setContent(ByteString.copyFrom(image))
                .setMimeType(mimeType)
                .build())
            .build();

        LOGGER.info("Sending {} byte {} image to Document AI processor {}", image.length, mimeType, processorName);
        ProcessResponse response;
        try {
            response = client.processDocument(request);
        } catch (ApiException ex) {
            throw new OcrClientException("Document AI request failed: " + ex.getStatusCode().getCode(), ex);
        }

        OcrAnalysis analysis = mapper.toAnalysis(response.getDocument());
        LOGGER.info("Document AI returned {} lines, {} tables and {} form fields", analysis.textLines().size(),
            analysis.tables().size(), analysis.keyValuePairs().size());
        return analysis;
    }

    @Override
    public void close() {
        client.close();
    }
}
