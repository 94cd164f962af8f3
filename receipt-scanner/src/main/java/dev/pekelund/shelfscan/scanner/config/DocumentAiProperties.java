package dev.pekelund.shelfscan.scanner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "documentai")
public class DocumentAiProperties {

    /**
     * Flag indicating whether receipt images are sent to Google Document AI.
     */
    private boolean enabled;

    /**
     * Google Cloud project that owns the processor.
     */
    private String projectId;

    /**
     * Processor location, for example {@code us} or {@code eu}.
     */
    private String location = "us";

    /**
     * Identifier of the Document AI processor used for receipts.
     */
    private String processorId;

    /**
     * Optional path or resource string that resolves to the service account credentials file.
     * When omitted, application default credentials will be used.
     */
    private String credentials;

    public boolean isComplete() {
        return StringUtils.hasText(projectId) && StringUtils.hasText(location) && StringUtils.hasText(processorId);
    }

    public String processorName() {
        return String.format("projects/%s/locations/%s/processors/%s", projectId, location, processorId);
    }

    public String endpoint() {
        return location + "-documentai.googleapis.com:443";
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getProcessorId() {
        return processorId;
    }

    public void setProcessorId(String processorId) {
        this.processorId = processorId;
    }

    public String getCredentials() {
        return credentials;
    }

    public void setCredentials(String credentials) {
        this.credentials = credentials;
    }
}
