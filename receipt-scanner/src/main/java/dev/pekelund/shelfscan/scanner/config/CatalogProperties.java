package dev.pekelund.shelfscan.scanner.config;

import dev.pekelund.shelfscan.receipts.ReceiptScanDefaults;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    /**
     * Flag indicating whether scanned products can be matched against the Firestore product catalog.
     */
    private boolean enabled;

    /**
     * Optional Google Cloud project identifier used when building the Firestore client.
     */
    private String projectId;

    /**
     * Firestore collection holding the catalog products.
     */
    private String collection = ReceiptScanDefaults.DEFAULT_CATALOG_COLLECTION;

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

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }
}
